/**
 * 인메모리 TTL/LRU 캐시.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.inmemory.cache;
