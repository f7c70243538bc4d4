package io.github.hongjungwan.muxlog.api;

/**
 * 호출자 식별자. 호출자별 버퍼 테이블의 키.
 *
 * 기본은 현재 스레드 기반이며, 스레드와 무관한 논리 호출자는 {@link #of(String)}로 지정.
 */
public record CallerId(String value) {

    public CallerId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Caller id must not be blank");
        }
    }

    /** 현재 스레드의 호출자 식별자 */
    public static CallerId current() {
        return forThread(Thread.currentThread());
    }

    /** 지정 스레드의 호출자 식별자 */
    public static CallerId forThread(Thread thread) {
        return new CallerId("thread-" + thread.getId());
    }

    /** 이름 기반 논리 호출자 */
    public static CallerId of(String value) {
        return new CallerId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
