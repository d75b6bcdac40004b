/**
 * Request-scoped observability helpers shared by Wishmaster services: correlation context
 * with an SLF4J MDC bridge, credential redaction for log payloads, and Micrometer meters.
 */
package com.wishmaster.observability;
