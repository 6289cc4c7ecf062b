package scribe.undo;

/**
 * Something that applies a transaction and returns the transaction that reverts it.
 * <p>
 * Applying the returned value must restore the state seen before the first call, and return a
 * transaction equivalent to the original one.
 */
public interface Fulfiller<T> {
  T fulfill(T transaction);

  /*
   * true when reciprocal reverts an edit that changed nothing; such edits are not recorded
   * */
  default boolean isEmpty(T reciprocal) {
    return false;
  }
}
