/**
 * 비교 전 속성 정규화 패키지.
 *
 * <p>{@link com.ryuqq.provisioner.core.normalize.PlaceholderResolver}로 치환한 뒤
 * {@link com.ryuqq.provisioner.core.normalize.AttributeComparator}가 필드 단위 차이를 계산합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.core.normalize;
