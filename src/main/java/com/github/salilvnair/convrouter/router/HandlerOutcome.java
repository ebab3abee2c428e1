package com.github.salilvnair.convrouter.router;

import java.time.Duration;

public sealed interface HandlerOutcome
        permits HandlerOutcome.Completed, HandlerOutcome.Failed, HandlerOutcome.TimedOut, HandlerOutcome.Cancelled {

    record Completed(Object response) implements HandlerOutcome {}
    record Failed(Throwable cause) implements HandlerOutcome {}
    record TimedOut(Duration timeout) implements HandlerOutcome {}
    record Cancelled(String reason) implements HandlerOutcome {}
}
