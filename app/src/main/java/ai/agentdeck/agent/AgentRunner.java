package ai.agentdeck.agent;

/**
 * Executes agent turns. Implementations either spawn the agent CLI ({@link CliAgentRunner}) or
 * drive an in-process agent.
 *
 * <p>{@link #launch} returns once the turn is under way. The runner then reports events through
 * the {@link TurnListener} from its own threads and finishes with exactly one of
 * {@link TurnListener#onExit(int)} or {@link TurnListener#onFailure(Throwable)}. When the token
 * is cancelled the runner must wind the turn down and still report its end.
 */
public interface AgentRunner {

    void launch(TurnRequest request, CancellationToken token, TurnListener listener) throws SpawnException;

    interface TurnListener {
        void onEvent(AgentEvent event);

        void onExit(int exitCode);

        void onFailure(Throwable error);
    }
}
