package org.carball.srql.compiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.srql.config.SrqlConfig;
import org.carball.srql.error.DuplicateClauseException;
import org.carball.srql.error.InvalidCursorException;
import org.carball.srql.error.SrqlException;
import org.carball.srql.error.SrqlResult;
import org.carball.srql.error.SrqlSyntaxException;
import org.carball.srql.model.query.PageDirection;
import org.carball.srql.model.query.Query;
import org.carball.srql.model.schema.SchemaCatalog;
import org.carball.srql.pagination.CursorCodec;
import org.carball.srql.pagination.CursorToken;
import org.carball.srql.parser.QueryParser;

/**
 * Entry point for {@code translate(query, cursor, direction, limit)}: parses the text, reconciles
 * the cursor and direction arguments with the query's own clauses and compiles the result.
 */
@Slf4j
public class QueryTranslator {

    private final QueryParser parser;
    private final QueryCompiler compiler;
    private final CursorCodec cursorCodec;

    public QueryTranslator(SchemaCatalog catalog, SrqlConfig config) {
        this(new QueryParser(config.getMaxStatsExpressions()), new QueryCompiler(catalog, config),
                new CursorCodec(config.getCursorSecret()));
    }

    public QueryTranslator(QueryParser parser, QueryCompiler compiler, CursorCodec cursorCodec) {
        this.parser = parser;
        this.compiler = compiler;
        this.cursorCodec = cursorCodec;
    }

    /**
     * Never throws for bad input; every parse or compile failure comes back as an error value.
     */
    public SrqlResult<CompiledQuery> translate(String query, String cursor, String direction, Integer limit) {
        try {
            return SrqlResult.ok(compile(query, cursor, direction, limit));
        } catch (SrqlException e) {
            log.debug("Translation failed: {}", e.getMessage());
            return SrqlResult.failure(e);
        }
    }

    public CompiledQuery compile(String text, String cursor, String direction, Integer limit) throws SrqlException {
        Query query = parse(text, limit);

        String effectiveCursor = query.getCursor();
        if (cursor != null && !cursor.isBlank()) {
            if (effectiveCursor != null && !effectiveCursor.equals(cursor)) {
                throw new DuplicateClauseException("cursor",
                        "cursor given both in the query and as an argument with different values");
            }
            effectiveCursor = cursor;
        }

        PageDirection requested = null;
        if (direction != null && !direction.isBlank()) {
            requested = PageDirection.parse(direction)
                    .orElseThrow(() -> new SrqlSyntaxException(
                            "invalid direction '" + direction + "', expected next or prev"));
        }

        CursorToken token = null;
        if (query.isAggregate()) {
            // aggregate results are a single page
            effectiveCursor = null;
            requested = PageDirection.NEXT;
        } else if (effectiveCursor != null) {
            token = cursorCodec.decode(effectiveCursor);
            if (requested != null && requested != token.getDirection()) {
                throw new InvalidCursorException("cursor was issued for direction '"
                        + token.getDirection().keyword() + "' but '" + requested.keyword() + "' was requested");
            }
            requested = token.getDirection();
        } else if (requested == PageDirection.PREV) {
            log.debug("Direction prev without a cursor, returning the first page");
            requested = PageDirection.NEXT;
        }

        Query resolved = query.toBuilder()
                .cursor(effectiveCursor)
                .direction(requested != null ? requested : PageDirection.NEXT)
                .build();
        return compiler.compile(resolved, token);
    }

    /**
     * Compiles the query as a first page, dropping any cursor.
     */
    public CompiledQuery compileFirstPage(String text, Integer limit) throws SrqlException {
        Query query = parse(text, limit).toBuilder()
                .cursor(null)
                .direction(PageDirection.NEXT)
                .build();
        return compiler.compile(query, null);
    }

    public CursorCodec getCursorCodec() {
        return cursorCodec;
    }

    private Query parse(String text, Integer limit) throws SrqlException {
        Query query = parser.parse(text);
        if (limit != null) {
            query = query.toBuilder().limit(limit).build();
        }
        return query;
    }
}
