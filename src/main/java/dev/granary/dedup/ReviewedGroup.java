package dev.granary.dedup;

import dev.granary.catalog.Announcement;
import dev.granary.catalog.ProjectGroup;
import java.util.List;

/** A project group together with its live members. */
public record ReviewedGroup(ProjectGroup group, List<Announcement> members) {

  public ReviewedGroup {
    members = List.copyOf(members);
  }
}
