package io.voxeldaemon.daemon.lifecycle;

/** Observes accepted transitions. Called on the thread that fired the event. */
@FunctionalInterface
public interface LifecycleListener {
    void onTransition(LifecycleStateMachine.Transition transition);
}
