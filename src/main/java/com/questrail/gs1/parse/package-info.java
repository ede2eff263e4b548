/**
 * GS1 Element String Decoding
 * =============================================================================
 *
 * <p>This package turns normalized scanner output into {@code ParseResult}s.
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String scan
 *        → InputNormalizer            (symbology, separators, trimming)
 *        → NoSeparatorBeamParser      (no separators in the scan)
 *          or FastPathParser          (separators present)
 *               → AmbiguitySolver     (unterminated field with hidden AI)
 *        → ResultAssembler
 *        → ParseResult
 * </pre>
 *
 * <p>Every engine here is:</p>
 * <ul>
 *   <li>synchronous and side-effect free</li>
 *   <li>bounded by the limits in {@code DecoderOptions}</li>
 *   <li>non-throwing for malformed scan data</li>
 * </ul>
 *
 * <p>Problems in the scan are reported as diagnostics on the result, never
 * as exceptions.</p>
 */
package com.questrail.gs1.parse;
