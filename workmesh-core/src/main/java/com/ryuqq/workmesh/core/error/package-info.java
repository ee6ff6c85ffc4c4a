/**
 * Error taxonomy.
 *
 * <ul>
 *   <li>{@link com.ryuqq.workmesh.core.error.ConfigurationException} - Work never named/attached; fatal</li>
 *   <li>{@link com.ryuqq.workmesh.core.error.ProvisioningException} - Backend could not create the execution context</li>
 *   <li>{@link com.ryuqq.workmesh.core.error.RemoteExecutionException} - The remote call raised</li>
 *   <li>{@link com.ryuqq.workmesh.core.error.CallTimeoutException} - No response within the configured bound</li>
 *   <li>{@link com.ryuqq.workmesh.core.error.CallCancelledException} - Work killed or failed while awaited</li>
 *   <li>{@link com.ryuqq.workmesh.core.error.StaleDeltaException} - Delta for a removed Work; dropped with a warning</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkMesh Team
 */
package com.ryuqq.workmesh.core.error;
