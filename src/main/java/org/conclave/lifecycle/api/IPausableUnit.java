package org.conclave.lifecycle.api;

/**
 * Optional extension of {@link ISupervisedUnit} for units that can suspend their work without
 * releasing their resources.
 */
public interface IPausableUnit extends ISupervisedUnit {

    /**
     * Suspends processing.
     *
     * @throws Exception if the unit cannot be paused.
     */
    void pause() throws Exception;

    /**
     * Resumes processing after {@link #pause()}.
     *
     * @throws Exception if the unit cannot be resumed.
     */
    void resume() throws Exception;
}
