package work.cacm.engine.runtime;

public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
