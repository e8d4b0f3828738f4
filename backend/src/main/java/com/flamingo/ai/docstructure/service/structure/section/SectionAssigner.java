package com.flamingo.ai.docstructure.service.structure.section;

import com.flamingo.ai.docstructure.service.structure.model.HeadingLevels;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns per-block heading levels into section ids.
 *
 * <p>Ids start at 0 and grow by one whenever a block at or above the pivot level differs in level
 * from the block before it. Runs of same-level headings stay in one section.
 */
@Component
public class SectionAssigner {

  public List<Integer> assign(HeadingLevels headingLevels) {
    List<Integer> levels = headingLevels.levels();
    int pivot = headingLevels.pivotLevel();
    List<Integer> sectionIds = new ArrayList<>(levels.size());
    int sectionId = 0;
    for (int i = 0; i < levels.size(); i++) {
      int level = levels.get(i);
      if (i > 0 && level <= pivot && level != levels.get(i - 1)) {
        sectionId++;
      }
      sectionIds.add(sectionId);
    }
    return sectionIds;
  }
}
