/**
 * 의존성 그래프 패키지.
 *
 * <p>{@link com.ryuqq.provisioner.core.graph.DependencyGraph}는 명시적 및 암시적 의존성으로
 * DAG를 구성하고, 순환을 경로와 함께 보고하며, (priority, 선언 순서) 기준의 결정적
 * 위상 정렬을 제공합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.core.graph;
