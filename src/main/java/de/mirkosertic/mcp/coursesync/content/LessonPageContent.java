package de.mirkosertic.mcp.coursesync.content;

import de.mirkosertic.mcp.coursesync.frontmatter.FrontMatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One lesson page as read from the repository, with the answers derived from its front matter.
 *
 * @param importKey repository path of the page file
 * @param position  1-based position inside the lesson
 */
public record LessonPageContent(String importKey, String title, String body, LessonPageType type,
                                List<LessonAnswer> answers, int position) {

    public static final String CONTINUE = "Continue";

    public LessonPageContent {
        answers = List.copyOf(answers);
    }

    /**
     * Builds a page from nested front matter:
     * <ul>
     *   <li>{@code content}: a single "Continue" answer to the next page, or the end of the lesson when last</li>
     *   <li>{@code truefalse}: True and False answers, {@code correct} (default true) names the right one,
     *       with {@code feedback_correct} and {@code feedback_incorrect} as responses</li>
     *   <li>{@code multichoice}: one answer per {@code answers} item ({@code text}, {@code correct}, {@code feedback})</li>
     * </ul>
     * Right answers score 1 and continue, wrong answers score 0 and stay on the page.
     */
    public static LessonPageContent fromFrontMatter(final String importKey, final String defaultTitle,
                                                    final FrontMatter frontMatter, final int position,
                                                    final boolean last) {
        final LessonPageType type = LessonPageType.fromName(frontMatter.getString("pagetype"));
        final String title = frontMatter.getString("title", defaultTitle);
        final List<LessonAnswer> answers = new ArrayList<>();

        switch (type) {
            case TRUE_FALSE -> {
                final boolean trueIsCorrect = frontMatter.getBoolean("correct", true);
                final String feedbackCorrect = frontMatter.getString("feedback_correct", "");
                final String feedbackIncorrect = frontMatter.getString("feedback_incorrect", "");
                answers.add(scored("True", trueIsCorrect ? feedbackCorrect : feedbackIncorrect, trueIsCorrect));
                answers.add(scored("False", trueIsCorrect ? feedbackIncorrect : feedbackCorrect, !trueIsCorrect));
            }
            case MULTI_CHOICE -> {
                for (final Object item : frontMatter.getList("answers")) {
                    if (item instanceof Map<?, ?> answer) {
                        answers.add(scored(stringValue(answer.get("text")), stringValue(answer.get("feedback")),
                                isTrue(answer.get("correct"))));
                    } else if (item != null) {
                        answers.add(scored(item.toString(), "", false));
                    }
                }
            }
            default -> answers.add(new LessonAnswer(CONTINUE, null, false, 0,
                    last ? LessonJump.END_OF_LESSON : LessonJump.NEXT_PAGE));
        }

        return new LessonPageContent(importKey, title, frontMatter.body(), type, answers, position);
    }

    private static LessonAnswer scored(final String text, final String feedback, final boolean correct) {
        return new LessonAnswer(text, feedback, correct, correct ? 1 : 0,
                correct ? LessonJump.NEXT_PAGE : LessonJump.THIS_PAGE);
    }

    private static String stringValue(final Object value) {
        return value != null ? value.toString() : "";
    }

    private static boolean isTrue(final Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        return value != null && ("true".equalsIgnoreCase(value.toString()) || "1".equals(value.toString()));
    }
}
