package org.carball.srql.builder;

import lombok.Builder;
import lombok.Value;
import org.carball.srql.error.SrqlError;

/**
 * Everything the editing session shows: structured state, query text and status flags.
 */
@Value
@Builder(toBuilder = true)
public class BuilderView {
    BuilderState state;
    String queryText;
    boolean editorVisible;

    /** Structured edits not yet written to {@code queryText}. */
    boolean dirty;

    /** The text uses syntax the structured editor cannot show; edits go through the text box. */
    boolean rawMode;
    String rawModeReason;

    SrqlError error;

    /** Set by {@link BuilderEvent.Run}; the host executes {@code queryText} and clears it with the next event. */
    boolean runRequested;

    public static BuilderView of(BuilderState state, String queryText) {
        return BuilderView.builder().state(state).queryText(queryText).build();
    }
}
