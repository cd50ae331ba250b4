/**
 * Configuration loading and runtime context.
 *
 * <p>YAML is parsed into the mutable {@link fr.lapetina.inference.sweep.infrastructure.config.SweepConfig}
 * tree, validated, and turned into immutable values at the boundary. The core only ever sees
 * {@link fr.lapetina.inference.sweep.domain.model.ResourceRequest} and
 * {@link fr.lapetina.inference.sweep.infrastructure.config.RuntimeContext}.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code model} - Model path, container image and served name</li>
 *   <li>{@code resources} - GPUs per node, worker counts and node budgets per role</li>
 *   <li>{@code nodes} - Optional explicit machine list overriding the SLURM allocation</li>
 *   <li>{@code launcher} - srun or local process launching</li>
 *   <li>{@code backend} - Serving backend flags per role</li>
 *   <li>{@code infrastructure} - Head node services</li>
 *   <li>{@code frontend} - Dynamo frontend or sglang router</li>
 *   <li>{@code benchmark} - Manual mode or a benchmark command</li>
 *   <li>{@code timeouts}, {@code monitor}, {@code cleanup} - Polling bounds and grace periods</li>
 *   <li>{@code metrics} - Prometheus metrics export</li>
 * </ul>
 *
 * @see fr.lapetina.inference.sweep.infrastructure.config.ConfigLoader
 * @see fr.lapetina.inference.sweep.infrastructure.config.RuntimeContext
 */
package fr.lapetina.inference.sweep.infrastructure.config;
