package tally.api;

/** Thrown when an operation is attempted on a component that is no longer usable. */
public class TallyStateException extends TallyException {

  public TallyStateException(Throwable cause) {
    super(cause);
  }

  public TallyStateException(String message) {
    super(message);
  }
}
