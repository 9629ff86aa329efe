package tally.api;

public class TallyException extends RuntimeException {

  public TallyException(Throwable cause) {
    super(cause);
  }

  public TallyException(String message) {
    super(message);
  }
}
