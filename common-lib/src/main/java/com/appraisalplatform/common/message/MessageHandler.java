package com.appraisalplatform.common.message;

import reactor.core.publisher.Mono;

@FunctionalInterface
public interface MessageHandler {

    Mono<Void> handle(Message message);
}
