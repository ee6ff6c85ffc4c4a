/**
 * Remote call outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the result of a
 * queue-mediated call to a Work.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workmesh.core.outcome.Ok} - The remote entry method returned a value</li>
 *   <li>{@link com.ryuqq.workmesh.core.outcome.Fail} - The remote entry method raised; classification preserved</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkMesh Team
 */
package com.ryuqq.workmesh.core.outcome;
