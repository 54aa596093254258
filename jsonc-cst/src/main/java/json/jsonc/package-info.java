/// Lossless parsing, printing and path-addressed editing of JSON-with-comments documents.
///
/// ## Reading
/// `Jsonc.parse(String)` builds a concrete syntax tree of `JsoncNode`s in which every node owns
/// the whitespace and comments around it. `Jsonc.toNative(JsoncNode)` strips that formatting
/// and returns plain maps, lists and scalars.
///
/// ## Writing
/// `Jsonc.setValue(JsoncNode, JsoncPath, Object)` replaces or inserts a value deep inside the
/// tree. `Jsonc.print(JsoncNode)` returns the original text, changed only where the edit landed.
///
/// ## Errors
/// All failures extend `JsoncException`: `JsoncLexException` and `JsoncParseException` carry a
/// source position, `JsoncPathTypeException` and `JsoncIndexException` carry the offending path step.
package json.jsonc;
