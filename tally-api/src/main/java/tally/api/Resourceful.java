package tally.api;

/** Base interface: only concerned with the resource itself. */
public interface Resourceful {

  /**
   * @return the unique id of this resource
   */
  String getResourceId();
}
