package dev.granary.dedup;

/**
 * Counters of one or more dedup batches.
 *
 * @param processed backlog announcements examined
 * @param groupsCreated new groups
 * @param projectsGrouped announcements that joined or founded a group
 */
public record GroupingResult(int processed, int groupsCreated, int projectsGrouped) {

  public static final GroupingResult EMPTY = new GroupingResult(0, 0, 0);

  public GroupingResult plus(GroupingResult other) {
    return new GroupingResult(
        processed + other.processed,
        groupsCreated + other.groupsCreated,
        projectsGrouped + other.projectsGrouped);
  }
}
