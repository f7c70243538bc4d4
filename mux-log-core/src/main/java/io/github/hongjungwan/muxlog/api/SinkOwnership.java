package io.github.hongjungwan.muxlog.api;

/**
 * Sink 소유권. OWNED는 Writer 종료 시 함께 닫히고, BORROWED는 호출자가 수명 관리.
 */
public enum SinkOwnership {
    OWNED,
    BORROWED
}
