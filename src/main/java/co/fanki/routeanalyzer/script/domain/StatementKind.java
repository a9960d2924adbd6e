package co.fanki.routeanalyzer.script.domain;

/**
 * Kinds of statement records produced by a {@link StatementSource}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum StatementKind {

    /** Named entry point; owns a body. */
    LABEL,

    /** Branching choice point; its body holds choices and captions. */
    MENU,

    /** One menu entry; owns the body executed when picked. */
    CHOICE,

    /** A line of dialogue or narration. */
    SAY,

    /** Unconditional transfer, no return. */
    JUMP,

    /** Transfer with an implied return to the call site. */
    CALL,

    /** Ends the current label's flow. */
    RETURN,

    /** Any other statement that owns a body (if, while, ...). */
    BLOCK,

    /** Anything the analyzer does not model. */
    OTHER

}
