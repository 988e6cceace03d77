package com.example.peak.model;

/**
 * 외부 협력자(추출기/보강/복구/벤더 조회) 호출 결과.
 * "설정 안 됨", "호출했지만 답 없음", "실패" 를 빈 문자열 하나로 뭉개지 않기 위함.
 */
public final class CollaboratorResult<T> {

    public enum Status { FOUND, NO_ANSWER, UNAVAILABLE, FAILED }

    private final Status status;
    private final T value;
    private final String error;

    private CollaboratorResult(Status status, T value, String error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> CollaboratorResult<T> found(T value) {
        if (value == null) return noAnswer();
        return new CollaboratorResult<>(Status.FOUND, value, null);
    }

    public static <T> CollaboratorResult<T> noAnswer() {
        return new CollaboratorResult<>(Status.NO_ANSWER, null, null);
    }

    public static <T> CollaboratorResult<T> unavailable() {
        return new CollaboratorResult<>(Status.UNAVAILABLE, null, null);
    }

    public static <T> CollaboratorResult<T> failed(String stage, Exception e) {
        String msg = stage + ": " + e.getClass().getSimpleName() + ": " + e.getMessage();
        return new CollaboratorResult<>(Status.FAILED, null, PeakRow.bound(msg));
    }

    public Status status() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /** FOUND 가 아니면 null */
    public T value() {
        return value;
    }

    public T orElse(T other) {
        return isFound() ? value : other;
    }

    public String error() {
        return error;
    }

    @Override
    public String toString() {
        return status + (isFound() ? "(" + value + ")" : isFailed() ? "(" + error + ")" : "");
    }
}
