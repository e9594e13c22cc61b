package json.ordered;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/// Captures a generic decode target such as `List<Map<String, Integer>>`.
///
/// ```java
/// var m = Json.decode(bytes, new TypeRef<Map<String, List<Long>>>() {});
/// ```
public abstract class TypeRef<T> {

    private final Type type;

    protected TypeRef() {
        final Type superclass = getClass().getGenericSuperclass();
        if (!(superclass instanceof ParameterizedType p)) {
            throw new IllegalStateException("TypeRef must be created with a type argument");
        }
        this.type = p.getActualTypeArguments()[0];
    }

    /// Returns the captured type.
    public Type type() {
        return type;
    }

    @Override
    public String toString() {
        return "TypeRef<" + type.getTypeName() + ">";
    }
}
