/// A small JSON front end: tokenizer, recursive descent parser and pretty-printer.
///
/// Text flows one way through three stages:
///
/// 1. {@link json.formatter.JsonTokenizer} turns text into {@link json.formatter.JsonToken}s,
///    decoding string escapes and converting numbers to `double`.
/// 2. {@link json.formatter.JsonParser} turns tokens into a {@link json.formatter.JsonValue}
///    tree. Object members stay in input order and duplicate keys are kept.
/// 3. {@link json.formatter.JsonFormatter} renders the tree with two-space indentation.
///
/// {@link json.formatter.Json#format(String)} chains the three. Every failure is a
/// {@link json.formatter.JsonFormatException}, either a
/// {@link json.formatter.JsonTokenizeException} or a {@link json.formatter.JsonParseException},
/// whose message is the diagnostic to show a user:
///
/// ```
/// Invalid escape character: 'x'
/// Invalid number literal: '1.2.3'
/// Unexpected literal: 'nulll'
/// Unexpected end of input
/// Unexpected token: ']'
/// ```
///
/// Logging uses `java.util.logging` under the `json.formatter` logger names. The
/// `json.formatter.maxDepth` system property bounds container nesting (default 512).
package json.formatter;
