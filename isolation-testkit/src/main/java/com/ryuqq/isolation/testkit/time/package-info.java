/**
 * 가상 시간 도구.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.testkit.time;
