/**
 * Service-side domain: login accounts and the login use case. Token and authorization logic
 * lives in {@code wishmaster-security}.
 */
package com.wishmaster.wishlist.domain;
