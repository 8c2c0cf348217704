package de.mirkosertic.mcp.coursesync.sync;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-run change counters and the human-readable summary built from them.
 */
public class SyncCounters {

    static final String NO_CHANGES = "No changes needed.";

    private int sectionsCreated;
    private int sectionsUpdated;
    private int sectionsHidden;
    private int activitiesCreated;
    private int activitiesUpdated;
    private int activitiesHidden;
    private int activitiesShown;
    private int chaptersCreated;
    private int chaptersUpdated;
    private int chaptersReordered;
    private int chaptersHidden;
    private int chaptersShown;
    private int lessonPagesCreated;
    private int lessonPagesUpdated;
    private int lessonPagesRemoved;
    private int assetsUploaded;
    private int skipped;

    public void sectionCreated() {
        sectionsCreated++;
    }

    public void sectionUpdated() {
        sectionsUpdated++;
    }

    public void sectionHidden() {
        sectionsHidden++;
    }

    public void activityCreated() {
        activitiesCreated++;
    }

    public void activityUpdated() {
        activitiesUpdated++;
    }

    public void activityHidden() {
        activitiesHidden++;
    }

    public void activityShown() {
        activitiesShown++;
    }

    public void chapterCreated() {
        chaptersCreated++;
    }

    public void chapterUpdated() {
        chaptersUpdated++;
    }

    public void chapterReordered() {
        chaptersReordered++;
    }

    public void chapterHidden() {
        chaptersHidden++;
    }

    public void chapterShown() {
        chaptersShown++;
    }

    public void lessonPageCreated() {
        lessonPagesCreated++;
    }

    public void lessonPageUpdated() {
        lessonPagesUpdated++;
    }

    public void lessonPageRemoved() {
        lessonPagesRemoved++;
    }

    public void assetsUploaded(final int count) {
        assetsUploaded += count;
    }

    public void skipped() {
        skipped++;
    }

    /**
     * Number of entities created, updated, hidden, shown, moved or removed.
     */
    public int totalChanges() {
        return sectionsHidden + activitiesCreated + activitiesUpdated + activitiesHidden + activitiesShown
                + chaptersCreated + chaptersUpdated + chaptersReordered + chaptersHidden + chaptersShown
                + lessonPagesCreated + lessonPagesUpdated + lessonPagesRemoved;
    }

    public String summary() {
        final List<String> parts = new ArrayList<>();
        add(parts, sectionsCreated, "section(s) created");
        add(parts, sectionsUpdated, "section(s) updated");
        add(parts, sectionsHidden, "section(s) hidden (removed from repo)");
        add(parts, activitiesCreated, "activity/activities created");
        add(parts, activitiesUpdated, "activity/activities updated");
        add(parts, activitiesHidden, "activity/activities hidden (removed from repo)");
        add(parts, activitiesShown, "activity/activities shown (back in repo)");
        add(parts, chaptersCreated, "chapter(s) created");
        add(parts, chaptersUpdated, "chapter(s) updated");
        add(parts, chaptersReordered, "chapter(s) reordered");
        add(parts, chaptersHidden, "chapter(s) hidden (removed from repo)");
        add(parts, chaptersShown, "chapter(s) shown (back in repo)");
        add(parts, lessonPagesCreated, "lesson page(s) created");
        add(parts, lessonPagesUpdated, "lesson page(s) updated");
        add(parts, lessonPagesRemoved, "lesson page(s) removed");
        add(parts, assetsUploaded, "asset(s) uploaded");
        if (parts.isEmpty()) {
            return NO_CHANGES;
        }
        return String.join(", ", parts) + ".";
    }

    private static void add(final List<String> parts, final int count, final String label) {
        if (count > 0) {
            parts.add(count + " " + label);
        }
    }

    public int getSectionsCreated() {
        return sectionsCreated;
    }

    public int getSectionsUpdated() {
        return sectionsUpdated;
    }

    public int getSectionsHidden() {
        return sectionsHidden;
    }

    public int getActivitiesCreated() {
        return activitiesCreated;
    }

    public int getActivitiesUpdated() {
        return activitiesUpdated;
    }

    public int getActivitiesHidden() {
        return activitiesHidden;
    }

    public int getActivitiesShown() {
        return activitiesShown;
    }

    public int getChaptersCreated() {
        return chaptersCreated;
    }

    public int getChaptersUpdated() {
        return chaptersUpdated;
    }

    public int getChaptersReordered() {
        return chaptersReordered;
    }

    public int getChaptersHidden() {
        return chaptersHidden;
    }

    public int getChaptersShown() {
        return chaptersShown;
    }

    public int getLessonPagesCreated() {
        return lessonPagesCreated;
    }

    public int getLessonPagesUpdated() {
        return lessonPagesUpdated;
    }

    public int getLessonPagesRemoved() {
        return lessonPagesRemoved;
    }

    public int getAssetsUploaded() {
        return assetsUploaded;
    }

    public int getSkipped() {
        return skipped;
    }
}
