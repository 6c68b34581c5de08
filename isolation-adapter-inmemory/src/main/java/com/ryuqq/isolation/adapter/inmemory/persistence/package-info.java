/**
 * In-memory 영속화 어댑터.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.adapter.inmemory.persistence;
