package org.carball.srql.builder;

import lombok.extern.slf4j.Slf4j;
import org.carball.srql.error.ErrorKind;
import org.carball.srql.error.SrqlError;
import org.carball.srql.error.SrqlException;

/**
 * Pure {@code (view, event) -> view} reduction for an editing session. The reducer holds no
 * session state; callers serialize events per session however their host requires.
 */
@Slf4j
public class BuilderReducer {

    private final QueryBuilder builder;

    public BuilderReducer(QueryBuilder builder) {
        this.builder = builder;
    }

    /**
     * Session start for an entity, with the canonical text already applied.
     */
    public BuilderView open(String entity) throws SrqlException {
        BuilderState state = builder.initialState(entity);
        return BuilderView.of(state, builder.serialize(state));
    }

    public BuilderView reduce(BuilderView view, BuilderEvent event) {
        BuilderView current = view.toBuilder().runRequested(false).build();

        if (event instanceof BuilderEvent.Toggle) {
            return current.toBuilder().editorVisible(!current.isEditorVisible()).build();
        }
        if (event instanceof BuilderEvent.EditQuery edit) {
            return editQuery(current, edit.text());
        }
        if (event instanceof BuilderEvent.Apply) {
            return apply(current);
        }
        if (event instanceof BuilderEvent.Run) {
            BuilderView applied = current.isRawMode() ? current : apply(current);
            if (applied.getError() != null) {
                return applied;
            }
            return applied.toBuilder().runRequested(true).build();
        }

        if (current.isRawMode()) {
            return current.toBuilder()
                    .error(rawModeError(current.getRawModeReason()))
                    .build();
        }

        try {
            BuilderState state = current.getState();
            BuilderState next;
            if (event instanceof BuilderEvent.SetEntity setEntity) {
                next = builder.setEntity(state, setEntity.entity());
            } else if (event instanceof BuilderEvent.AddFilter add) {
                next = builder.addFilter(state, add.field(), add.operator(), add.values());
            } else if (event instanceof BuilderEvent.RemoveFilter remove) {
                next = builder.removeFilter(state, remove.index());
            } else if (event instanceof BuilderEvent.RemoveField remove) {
                next = builder.removeField(state, remove.field());
            } else if (event instanceof BuilderEvent.ChangeFilter change) {
                next = builder.changeFilter(state, change.index(), change.filter());
            } else if (event instanceof BuilderEvent.SetTime setTime) {
                next = builder.setTime(state, setTime.window());
            } else if (event instanceof BuilderEvent.SetSort setSort) {
                next = builder.setSort(state, setSort.sort());
            } else if (event instanceof BuilderEvent.SetLimit setLimit) {
                next = builder.setLimit(state, setLimit.limit());
            } else {
                throw new IllegalArgumentException("Unknown builder event: " + event);
            }
            return current.toBuilder()
                    .state(next)
                    .dirty(current.isDirty() || !next.equals(state))
                    .error(null)
                    .build();
        } catch (SrqlException e) {
            log.debug("Rejected builder event {}: {}", event, e.getMessage());
            return current.toBuilder().error(SrqlError.of(e)).build();
        }
    }

    private BuilderView apply(BuilderView view) {
        if (view.isRawMode()) {
            return view.toBuilder().error(rawModeError(view.getRawModeReason())).build();
        }
        return view.toBuilder()
                .queryText(builder.serialize(view.getState()))
                .dirty(false)
                .error(null)
                .build();
    }

    /**
     * Text edits win over the structured state. Text the editor cannot represent switches to raw
     * mode and leaves the last structured state in place; invalid text only records the error.
     */
    private BuilderView editQuery(BuilderView view, String text) {
        BuilderView edited = view.toBuilder().queryText(text).build();
        try {
            BuilderState state = builder.parse(text);
            return edited.toBuilder()
                    .state(state)
                    .rawMode(false)
                    .rawModeReason(null)
                    .dirty(false)
                    .error(null)
                    .build();
        } catch (RawModeRequiredException e) {
            return edited.toBuilder()
                    .rawMode(true)
                    .rawModeReason(e.getMessage())
                    .dirty(false)
                    .error(null)
                    .build();
        } catch (SrqlException e) {
            return edited.toBuilder().error(SrqlError.of(e)).build();
        }
    }

    private static SrqlError rawModeError(String reason) {
        return new SrqlError(ErrorKind.UNSUPPORTED_EXPRESSION,
                "switch to raw mode: " + reason, -1);
    }
}
