/**
 * Translation of domain exceptions into HTTP error bodies.
 */
package com.phillippitts.sessioncore.presentation.exception;
