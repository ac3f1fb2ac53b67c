package validator;

// Phases of a validation run, entered strictly in this order.
public enum RunPhase {
    INIT,
    PROCESS,
    FINALIZE
}
