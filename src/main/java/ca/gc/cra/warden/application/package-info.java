/**
 * Application layer of the Warden security core: the four subsystems and the ports they depend on.
 * <p><strong>Role:</strong> Use cases coordinating domain values through {@code application.port} interfaces;
 * infrastructure adapters are injected by {@code config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Periodic work runs on a single security loop thread; the access gates are
 * called from arbitrary caller threads and guard shared collections with one lock per collection.</p>
 */
package ca.gc.cra.warden.application;
