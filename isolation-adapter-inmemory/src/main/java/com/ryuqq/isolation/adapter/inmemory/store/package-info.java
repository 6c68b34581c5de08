/**
 * In-memory {@link com.ryuqq.isolation.core.spi.BreakerStore} 구현.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.adapter.inmemory.store;
