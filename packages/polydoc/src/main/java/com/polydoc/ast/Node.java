package com.polydoc.ast;

/**
 * A document AST node, decoded from its {@code {"t": ..., "c": ...}} JSON form.
 *
 * <p>The node kinds the filters act on have their own record; every other tag is carried by {@link
 * GenericNode} with its content left as opaque JSON. Tags are only compared as strings inside
 * {@link NodeCodec}; everything else works on these types.
 *
 * <p>JSON payloads held by nodes (inline lists, nested blocks) are never mutated; transformations
 * build new values.
 */
public sealed interface Node
    permits CodeBlock, RawBlock, Div, Para, Plain, Header, Image, Str, GenericNode {

  /** The AST tag, e.g. {@code "CodeBlock"}. */
  String type();
}
