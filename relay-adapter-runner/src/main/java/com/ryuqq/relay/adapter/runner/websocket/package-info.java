/**
 * WebSocket 클라이언트와 JDK 연결 팩토리.
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner.websocket;
