package json.ordered;

/// Thrown when a user-supplied hook fails, either by throwing or by
/// returning output that is not well-formed JSON.
public class JsonMarshalerException extends JsonException {

    private static final long serialVersionUID = 1L;

    private final transient Class<?> hookType;
    private final String hookMethod;

    /// Creates a report for a failing hook.
    /// @param hookType the class whose hook failed
    /// @param hookMethod the name of the hook method
    /// @param cause what went wrong
    public JsonMarshalerException(Class<?> hookType, String hookMethod, Throwable cause) {
        super("json: error calling " + hookMethod + " for type " + hookType.getName() + ": " + cause.getMessage(), cause);
        this.hookType = hookType;
        this.hookMethod = hookMethod;
    }

    /// Returns the class whose hook failed.
    public Class<?> hookType() {
        return hookType;
    }

    /// Returns the hook method name.
    public String hookMethod() {
        return hookMethod;
    }
}
