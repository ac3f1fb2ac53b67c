package validator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// The source module's `export const NAME = [ ... ];` block. Only that block and `// Total: N words` comments are rewritten.
public class WordListFile {

    public static final String DEFAULT_LIST_NAME = "SOLUTIONS_LIST";

    private static final Pattern TOTAL_COMMENT = Pattern.compile("//\\s*Total:\\s*\\d+\\s*words");

    private final String rawContent;
    private final String listName;
    private final Pattern block;
    private final List<String> words;

    private WordListFile(String rawContent, String listName, Pattern block, List<String> words) {
        this.rawContent = rawContent;
        this.listName = listName;
        this.block = block;
        this.words = words;
    }

    public static WordListFile parse(String rawContent, String listName) {
        Pattern block = blockPattern(listName);
        Matcher m = block.matcher(rawContent);
        if (!m.find()) {
            throw new WordListFormatException("Could not find the " + listName + " export. Check formatting.");
        }

        List<String> words = new ArrayList<>();
        for (String token : m.group(1).split(",")) {
            String w = token.trim().replaceAll("['\"]", "");
            if (!w.isEmpty()) words.add(w);
        }
        return new WordListFile(rawContent, listName, block, List.copyOf(words));
    }

    private static Pattern blockPattern(String listName) {
        return Pattern.compile("export const " + Pattern.quote(listName) + "\\s*=\\s*\\[([\\s\\S]*?)\\]\\s*;");
    }

    // Entries in file order, quotes stripped, original case
    public List<String> words() {
        return words;
    }

    // Trimmed entries of exactly wordLength characters, in file order
    public List<String> workingSubset(int wordLength) {
        List<String> subset = new ArrayList<>();
        for (String w : words) {
            String t = w.trim();
            if (t.length() == wordLength) subset.add(t);
        }
        return subset;
    }

    public String rewrite(List<String> validWords) {
        String replaced = block.matcher(rawContent).replaceFirst(Matcher.quoteReplacement(renderBlock(validWords)));
        return TOTAL_COMMENT.matcher(replaced)
                .replaceAll(Matcher.quoteReplacement("// Total: " + validWords.size() + " words"));
    }

    String renderBlock(List<String> validWords) {
        StringBuilder sb = new StringBuilder("export const ").append(listName).append(" = [\n");
        for (int i = 0; i < validWords.size(); i++) {
            sb.append("  \"").append(validWords.get(i).toLowerCase(Locale.ROOT)).append('"');
            if (i < validWords.size() - 1) sb.append(',');
            sb.append('\n');
        }
        return sb.append("];").toString();
    }
}
