package com.bftchain.timer;

import com.bftchain.state.Step;

import lombok.Value;

/**
 * Stamp of a scheduled timeout. The engine ignores a timeout whose stamp no
 * longer matches its (height, round, step).
 */
@Value
public class TimeoutInfo {
    long height;
    int round;
    Step step;
    long durationMs;
}
