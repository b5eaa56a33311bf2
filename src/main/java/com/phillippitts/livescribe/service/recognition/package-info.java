/**
 * Recognition client abstraction.
 *
 * <p>The session coordinator only talks to
 * {@link com.phillippitts.livescribe.service.recognition.RecognitionClient}; the Deepgram
 * implementation lives in the {@code deepgram} subpackage. Results flow back through a
 * {@link com.phillippitts.livescribe.service.recognition.FragmentStream} drained by one pump
 * task per session.
 *
 * @since 1.0
 */
package com.phillippitts.livescribe.service.recognition;
