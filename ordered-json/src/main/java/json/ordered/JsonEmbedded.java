package json.ordered;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Marks a field whose own fields are promoted into the enclosing object.
///
/// An embedded aggregate is traversed even when the field itself is not
/// public. An embedded field whose type is not an aggregate is an ordinary
/// member named after the simple name of its type, and only when that type
/// is public. A {@link JsonField} name on the field stops the promotion and
/// makes it an ordinary member.
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface JsonEmbedded {
}
