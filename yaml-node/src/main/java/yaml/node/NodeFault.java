package yaml.node;

/// The kinds of failure a [Node] operation can run into.
///
/// None of these is ever thrown. Operations report them through the
/// `yaml.node` logger and return an empty, default, `false` or undefined result.
public enum NodeFault {
    /// A typed value could not be encoded, or a scalar could not be decoded.
    CONVERSION_FAILURE,
    /// The node has a shape the operation cannot use and cannot grow into.
    SHAPE_MISMATCH,
    /// The handle refers to no storage.
    INVALID_HANDLE;

    /// Formats a diagnostic line for this fault.
    ///
    /// @param operation the node operation that failed
    /// @param detail what went wrong
    /// @return the message, prefixed with the fault name
    String describe(String operation, String detail) {
        return name() + " in " + operation + ": " + detail;
    }
}
