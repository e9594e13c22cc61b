package json.ordered;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Configures how a field or record component maps to an object member.
///
/// A non-empty {@link #value()} renames the member and counts as an explicit
/// name when same-named embedded fields compete. Names may use letters,
/// digits and the punctuation ``!#$%&()*+-./:;<=>?@[]^_{|}~ ``; any other
/// name is ignored and the field keeps its own name.
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface JsonField {

    /// Member name; empty keeps the field name.
    String value() default "";

    /// Leaves the member out when it holds an empty value: `false`, `0`, `""`,
    /// `null`, or an empty array, collection, map or `Optional`.
    boolean omitEmpty() default false;

    /// Writes a boolean, number or string as a JSON string, and reads it back
    /// from one.
    boolean string() default false;

    /// Excludes the field entirely.
    boolean exclude() default false;
}
