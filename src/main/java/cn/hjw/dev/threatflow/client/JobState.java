package cn.hjw.dev.threatflow.client;

public enum JobState {
    RUNNING,
    COMPLETED,
    FAILED
}
