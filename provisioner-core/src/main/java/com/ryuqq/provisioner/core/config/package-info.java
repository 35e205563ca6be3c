/**
 * 엔진 설정 패키지.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.core.config;
