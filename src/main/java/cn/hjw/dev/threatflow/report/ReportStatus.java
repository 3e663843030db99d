package cn.hjw.dev.threatflow.report;

public enum ReportStatus {
    SUCCESS,
    FAILURE
}
