/**
 * Jackson configuration shared by the file-based adapters.
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.adapter.file.json;
