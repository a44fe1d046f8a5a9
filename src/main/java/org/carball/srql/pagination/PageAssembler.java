package org.carball.srql.pagination;

import lombok.extern.slf4j.Slf4j;
import org.carball.srql.compiler.QueryPlan;
import org.carball.srql.model.query.PageDirection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Turns the rows of a {@code limit + 1} fetch into a page: drops the probe row, restores the
 * requested order for {@code prev} fetches and derives the neighbouring cursors from the
 * first and last returned rows.
 */
@Slf4j
public class PageAssembler {

    private final CursorCodec cursorCodec;

    public PageAssembler(CursorCodec cursorCodec) {
        this.cursorCodec = cursorCodec;
    }

    public Page assemble(QueryPlan plan, List<Map<String, Object>> fetched) {
        int limit = plan.getLimit();
        if (!plan.isPaginated()) {
            List<Map<String, Object>> rows = fetched.size() > limit ? fetched.subList(0, limit) : fetched;
            return new Page(List.copyOf(rows), PaginationMeta.none(limit));
        }

        boolean hasMore = fetched.size() > limit;
        List<Map<String, Object>> rows = new ArrayList<>(hasMore ? fetched.subList(0, limit) : fetched);
        String prevCursor = null;
        String nextCursor = null;

        if (plan.getDirection() == PageDirection.PREV) {
            Collections.reverse(rows);
            if (!rows.isEmpty()) {
                if (hasMore) {
                    prevCursor = cursorFor(plan, rows.get(0), PageDirection.PREV);
                }
                nextCursor = cursorFor(plan, rows.get(rows.size() - 1), PageDirection.NEXT);
            }
        } else if (!rows.isEmpty()) {
            if (hasMore) {
                nextCursor = cursorFor(plan, rows.get(rows.size() - 1), PageDirection.NEXT);
            }
            if (plan.getCursor() != null) {
                prevCursor = cursorFor(plan, rows.get(0), PageDirection.PREV);
            }
        }

        log.debug("Assembled page of {} rows (more: {}, prev: {}, next: {})",
                rows.size(), hasMore, prevCursor != null, nextCursor != null);
        return new Page(Collections.unmodifiableList(rows), new PaginationMeta(prevCursor, nextCursor, limit));
    }

    private String cursorFor(QueryPlan plan, Map<String, Object> row, PageDirection direction) {
        Object sortValue = row.get(plan.getSort().field());
        Object tieBreak = row.get(plan.getSchema().getTieBreakColumn());
        if (sortValue == null || tieBreak == null) {
            log.warn("Row has no value for sort key ({}, {}); no cursor issued",
                    plan.getSort().field(), plan.getSchema().getTieBreakColumn());
            return null;
        }
        return cursorCodec.encode(CursorToken.of(sortValue, tieBreak, direction, plan.getFingerprint()));
    }
}
