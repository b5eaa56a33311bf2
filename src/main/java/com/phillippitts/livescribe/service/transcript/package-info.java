/**
 * Per-session transcript accumulation.
 */
package com.phillippitts.livescribe.service.transcript;
