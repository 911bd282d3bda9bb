/**
 * Domain model: services, instances, routing and traffic rules, deployments.
 *
 * <p>Descriptors are immutable; state changes produce new values
 * ({@code withState}, {@code withVersion}, {@code transitionTo}).
 */
package fr.lapetina.orchestrator.domain.model;
