package ai.agentdeck.terminal;

public enum TerminalStatus {
    RUNNING,
    IDLE,
    ATTENTION,
    DONE
}
