/**
 * The boundary between tally and a key-value store.
 */
package works.tally.store;
