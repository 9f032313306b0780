package gate.core.model;

/**
 * One rate limit enforced by a coordinator.
 *
 * Checking and recording are split: {@link #tryAdmit()} only reports capacity,
 * {@link #commit(long)} records an admission the caller has decided to make.
 * Implementations guard each of the two with their own critical section.
 */
public interface AdmissionRule {

    /**
     * Evicts expired entries and reports whether one more admission fits,
     * reading the rule's clock inside the critical section.
     */
    AdmitResult tryAdmit();

    /**
     * Records an admission at {@code timestampNanos} without re-checking capacity.
     */
    void commit(long timestampNanos);
}
