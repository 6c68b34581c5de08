/**
 * In-memory 이벤트 채널.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.adapter.inmemory.event;
