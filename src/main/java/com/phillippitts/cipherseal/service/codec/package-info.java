/**
 * Keyed LSB steganography codec.
 *
 * <p>Two cooperating pieces, used symmetrically by embed and extract:
 * <ul>
 *   <li>{@link com.phillippitts.cipherseal.service.codec.KeyedLocationGenerator} - turns a secret key
 *       and image dimensions into a deterministic permutation of all (x, y, channel) slots, using
 *       the pinned {@link com.phillippitts.cipherseal.service.codec.MersenneTwister}</li>
 *   <li>{@link com.phillippitts.cipherseal.service.codec.LsbBitCodec} - walks that order writing or
 *       reading one bit per slot; payloads are framed by
 *       {@link com.phillippitts.cipherseal.service.codec.BinaryPayload}</li>
 * </ul>
 *
 * <p>Seed folding, generator and initial slot order together define the watermark format. Changing
 * any of them makes every previously watermarked image unreadable.
 *
 * <p>Nothing in this package performs I/O or depends on Spring; the CLI uses it directly.
 */
package com.phillippitts.cipherseal.service.codec;
