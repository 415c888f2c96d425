/**
 * Wire protocol codecs.
 */
package ca.gc.cra.formdata.infrastructure.protocol;
