/**
 * 프로젝트 {@code scripts/} 디렉토리의 셸 스크립트를 자식 프로세스로 실행하는 협력자 구현.
 *
 * @since 1.0.0
 */
package com.ryuqq.prp.adapter.script;
