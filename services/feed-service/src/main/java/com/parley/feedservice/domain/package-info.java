/**
 * Feed use cases: posting and paging messages, creating groups, and the subscription definitions
 * served over server-sent events.
 *
 * <p>Services here depend on the persistence adapters and the shared libraries, never on the web
 * layer.
 */
package com.parley.feedservice.domain;
