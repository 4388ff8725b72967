package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.event.RegistryEvent;

/**
 * 레지스트리 이벤트 구독자.
 *
 * @author Registry Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RegistryEventListener {

    /**
     * 커밋된 이벤트 수신.
     *
     * @param event 이벤트
     */
    void onEvent(RegistryEvent event);
}
