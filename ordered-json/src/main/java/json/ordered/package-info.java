/// Order-preserving JSON codec.
///
/// {@link json.ordered.Json} is the entry point: it encodes host values
/// (records, classes with public fields, collections, maps, scalars and the
/// {@link json.ordered.JsonValue} model) to bytes and decodes bytes back. The
/// wire form is fixed: every non-ASCII character is escaped, HTML-sensitive
/// characters are escaped by default, floats use the shortest round-trip
/// text and maps are emitted in key order while {@link json.ordered.JsonObject}
/// keeps its members in the order given.
///
/// {@link json.ordered.JsonEncoder} and {@link json.ordered.JsonDecoder} work
/// on streams of values.
package json.ordered;
