/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters and
 * throw domain exceptions only; {@code presentation.exception} maps them to HTTP statuses.
 */
package com.phillippitts.cipherseal.presentation;
