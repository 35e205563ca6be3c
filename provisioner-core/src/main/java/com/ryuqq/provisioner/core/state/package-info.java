/**
 * 영속 State 모델 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.state.State} - lineage, serial, target key, 주소별 항목</li>
 *   <li>{@link com.ryuqq.provisioner.core.state.StateEntry} - 속성, 의존성, 우선순위, 생성/변경 시각</li>
 *   <li>{@link com.ryuqq.provisioner.core.state.CanonicalDigest} - 정규 JSON SHA-256</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.core.state;
