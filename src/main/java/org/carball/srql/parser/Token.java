package org.carball.srql.parser;

/**
 * Raw whitespace-delimited token with its position in the query.
 */
public record Token(String text, int offset) {
}
