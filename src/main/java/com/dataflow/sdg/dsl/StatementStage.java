package com.dataflow.sdg.dsl;

/**
 * Common behaviour of the objects returned along a declaration statement.
 *
 * <p>
 * Every stage may be used once: calling a second method on a stage that
 * already handed the registrar forward throws {@link IllegalStateException}.
 */
abstract class StatementStage {
    protected final Registrar registrar;
    private boolean consumed;

    StatementStage(Registrar registrar) {
        this.registrar = registrar;
    }

    protected final void consume() {
        checkNotConsumed();
        consumed = true;
    }

    protected final void checkNotConsumed() {
        if (consumed)
            throw new IllegalStateException("This stage of " + registrar.statement() + " was already used");
    }

    /**
     * Commits the statement now, without further stages.
     *
     * @throws IllegalStateException if the statement has no input family yet
     */
    public RegistrationResult register() {
        consume();
        return registrar.close();
    }
}
