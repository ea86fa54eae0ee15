package com.pitwall.decoder;

/**
 * @param enabled   플랩이 열린 상태
 * @param available 해당 구간에서 DRS 사용 가능
 */
public record DrsState(boolean enabled, boolean available) {

    public static final DrsState OFF = new DrsState(false, false);
    public static final DrsState ARMED = new DrsState(false, true);
    public static final DrsState OPEN = new DrsState(true, true);
}
