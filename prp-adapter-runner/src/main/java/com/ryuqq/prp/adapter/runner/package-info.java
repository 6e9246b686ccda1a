/**
 * QueueRuntime 구현체 (단일 패스 및 daemon 모드).
 *
 * @since 1.0.0
 */
package com.ryuqq.prp.adapter.runner;
