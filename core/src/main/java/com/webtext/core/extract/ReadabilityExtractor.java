package com.webtext.core.extract;

import com.webtext.core.api.IContentExtractor;
import com.webtext.core.model.ExtractedDocument;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JSoup 기반 리더빌리티 추출기.
 *  - 제목: og:title → &lt;title&gt;(사이트명 꼬리 제거) → 첫 h1
 *  - 본문: 보일러플레이트 제거 → 문단 점수를 부모/조부모로 전파 → 링크 밀도 보정
 *    → 최고 후보 + 조건을 만족하는 형제 → 조건부 정리
 *  - 1차 결과가 짧으면(250자 미만) unlikely 후보를 지우지 않고 한 번 더 시도
 */
public class ReadabilityExtractor implements IContentExtractor {

    static final int MIN_PARAGRAPH_LENGTH = 25;
    static final int RETRY_LENGTH = 250;

    private static final String BOILERPLATE_TAGS =
            "script, style, noscript, iframe, object, embed, form, nav, header, footer, aside, "
                    + "svg, canvas, button, input, select, textarea, link, meta, template";

    private static final Pattern UNLIKELY = Pattern.compile(
            "combx|comment|community|disqus|extra|foot|header|menu|remark|rss|shoutbox|sidebar|sponsor"
                    + "|ad-break|agegate|pagination|pager|popup|tweet|twitter|cookie|banner|share|social|related",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MAYBE = Pattern.compile(
            "and|article|body|column|main|shadow|content", Pattern.CASE_INSENSITIVE);
    private static final Pattern POSITIVE = Pattern.compile(
            "article|body|content|entry|hentry|main|page|post|text|blog|story", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEGATIVE = Pattern.compile(
            "combx|comment|com-|contact|foot|footer|footnote|masthead|media|meta|outbrain|promo|related"
                    + "|scroll|shoutbox|sidebar|sponsor|shopping|tags|tool|widget|nav|menu|ad-",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SENTENCE_END = Pattern.compile("\\.( |$)");
    private static final Pattern CHARSET = Pattern.compile("charset=[\"']?([\\w.:\\-]+)", Pattern.CASE_INSENSITIVE);

    private static final String[] TITLE_SEPARATORS = {" | ", " - ", " – ", " — ", " :: ", " » ", " / "};
    private static final String DIV_BLOCK_CHILDREN = "a, blockquote, dl, div, img, ol, p, pre, table, ul";

    @Override
    public ExtractedDocument extract(byte[] raw, String contentType, String baseUri) {
        if (raw == null || raw.length == 0) return ExtractedDocument.EMPTY;
        Document doc = parse(raw, contentType, baseUri);

        String title = extractTitle(doc);

        Element article = grabArticle(doc.clone(), true);
        if (textLength(article) < RETRY_LENGTH) {
            Element second = grabArticle(doc.clone(), false);
            if (textLength(second) > textLength(article)) article = second;
        }
        String body = (article == null) ? "" : render(article, baseUri);
        return new ExtractedDocument(title, body);
    }

    // ================= 파싱 =================

    static Document parse(byte[] raw, String contentType, String baseUri) {
        String charset = charsetOf(contentType);
        try {
            return Jsoup.parse(new ByteArrayInputStream(raw), charset, baseUri == null ? "" : baseUri);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse document", e);
        }
    }

    /** Content-Type 헤더의 charset. 없거나 모르는 이름이면 null(문서에서 감지). */
    static String charsetOf(String contentType) {
        if (contentType == null) return null;
        Matcher m = CHARSET.matcher(contentType);
        if (!m.find()) return null;
        String name = m.group(1);
        try {
            return Charset.isSupported(name) ? name : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    // ================= 제목 =================

    static String extractTitle(Document doc) {
        String og = doc.select("meta[property=og:title]").attr("content").trim();
        if (!og.isEmpty()) return og;

        String t = cleanTitle(doc.title());
        if (!t.isEmpty()) return t;

        Element h1 = doc.selectFirst("h1");
        return (h1 == null) ? "" : h1.text().trim();
    }

    /** "기사 제목 | 사이트명" → "기사 제목". 잘라낸 쪽이 3단어 미만이면 반대쪽, 그래도 아니면 원문. */
    static String cleanTitle(String raw) {
        if (raw == null) return "";
        String t = raw.trim();
        int lastAt = -1;
        int firstAt = Integer.MAX_VALUE;
        String firstSep = null;
        for (String sep : TITLE_SEPARATORS) {
            int last = t.lastIndexOf(sep);
            if (last > lastAt) lastAt = last;
            int first = t.indexOf(sep);
            if (first >= 0 && first < firstAt) {
                firstAt = first;
                firstSep = sep;
            }
        }
        if (lastAt < 0) return t;

        String head = t.substring(0, lastAt).trim();
        if (wordCount(head) >= 3) return head;
        String tail = t.substring(firstAt + firstSep.length()).trim();
        if (wordCount(tail) >= 3) return tail;
        return t;
    }

    private static int wordCount(String s) {
        String x = s.trim();
        return x.isEmpty() ? 0 : x.split("\\s+").length;
    }

    // ================= 본문 =================

    private Element grabArticle(Document doc, boolean stripUnlikely) {
        doc.select(BOILERPLATE_TAGS).remove();
        removeComments(doc);

        Element body = doc.body();
        if (body == null) return null;

        if (stripUnlikely) {
            for (Element el : new ArrayList<>(body.getAllElements())) {
                if (el == body || el.parent() == null) continue;
                String match = el.className() + " " + el.id();
                if (UNLIKELY.matcher(match).find() && !MAYBE.matcher(match).find()) {
                    el.remove();
                }
            }
        }

        // 블록 자식이 없는 div는 문단으로 취급
        for (Element div : body.select("div")) {
            boolean hasBlock = false;
            for (Element d : div.select(DIV_BLOCK_CHILDREN)) {
                if (d != div) { hasBlock = true; break; }
            }
            if (!hasBlock) div.tagName("p");
        }

        Map<Element, Double> scores = new IdentityHashMap<>();
        List<Element> candidates = new ArrayList<>();
        for (Element para : body.select("p, pre, td")) {
            Element parent = para.parent();
            if (parent == null) continue;
            String text = para.text();
            if (text.length() < MIN_PARAGRAPH_LENGTH) continue;

            Element grand = parent.parent();
            init(parent, scores, candidates);
            if (grand != null) init(grand, scores, candidates);

            double score = 1 + countCommas(text) + Math.min(text.length() / 100, 3);
            scores.merge(parent, score, Double::sum);
            if (grand != null) scores.merge(grand, score / 2.0, Double::sum);
        }

        Element top = null;
        double topScore = 0;
        for (Element c : candidates) {
            double s = scores.get(c) * (1 - linkDensity(c));
            scores.put(c, s);
            if (top == null || s > topScore) {
                top = c;
                topScore = s;
            }
        }

        if (top == null) {
            // 점수 낼 문단이 없음: body 전체를 그대로 쓴다
            Element article = new Element("div");
            for (Node child : new ArrayList<>(body.childNodes())) article.appendChild(child.clone());
            return article;
        }

        Element article = new Element("div");
        double threshold = Math.max(10, topScore * 0.2);
        Element parent = top.parent();
        List<Element> siblings = (parent == null || top == body) ? List.of(top) : new ArrayList<>(parent.children());
        for (Element sibling : siblings) {
            if (sibling == top || scores.getOrDefault(sibling, Double.NEGATIVE_INFINITY) >= threshold) {
                article.appendChild(sibling.clone());
                continue;
            }
            if (sibling.normalName().equals("p")) {
                String text = sibling.text();
                double density = linkDensity(sibling);
                if (text.length() > 80 && density < 0.25) {
                    article.appendChild(sibling.clone());
                } else if (text.length() <= 80 && density == 0 && SENTENCE_END.matcher(text).find()) {
                    article.appendChild(sibling.clone());
                }
            }
        }

        cleanConditionally(article, stripUnlikely);
        return article;
    }

    private static void init(Element el, Map<Element, Double> scores, List<Element> candidates) {
        if (scores.containsKey(el)) return;
        double score;
        switch (el.normalName()) {
            case "div": score = 5; break;
            case "pre": case "td": case "blockquote": score = 3; break;
            case "address": case "ol": case "ul": case "dl": case "dd": case "dt": case "li": case "form":
                score = -3; break;
            case "h1": case "h2": case "h3": case "h4": case "h5": case "h6": case "th":
                score = -5; break;
            default: score = 0;
        }
        scores.put(el, score + classWeight(el));
        candidates.add(el);
    }

    /**
     * 목록/표/div 중 내용보다 링크·이미지가 많은 덩어리를 걷어낸다. article과 그 직계 자식(선택된 후보들)은 유지.
     * ruthless가 아니면(2차 시도) 클래스 가중치만으로는 지우지 않는다.
     */
    private static void cleanConditionally(Element article, boolean ruthless) {
        Elements all = article.select("table, ul, div, h1, h2, h3");
        for (int i = all.size() - 1; i >= 0; i--) {
            Element el = all.get(i);
            if (el == article || el.parent() == null || el.parent() == article) continue;
            int weight = classWeight(el);
            double density = linkDensity(el);

            if (el.normalName().matches("h[1-3]")) {
                if (weight < 0 || density > 0.33) el.remove();
                continue;
            }
            if (weight < 0 && ruthless) {
                el.remove();
                continue;
            }
            String text = el.text();
            if (countCommas(text) >= 10) continue;

            int p = el.getElementsByTag("p").size();
            int img = el.getElementsByTag("img").size();
            int li = el.getElementsByTag("li").size() - 100;
            int inputs = el.getElementsByTag("input").size();
            boolean list = el.normalName().equals("ul") || el.normalName().equals("ol");

            boolean remove = (img > p && img > 1)
                    || (!list && li > p)
                    || inputs > p / 3
                    || (text.length() < MIN_PARAGRAPH_LENGTH && (img == 0 || img > 2))
                    || (weight < 25 && density > 0.2)
                    || density > 0.5;
            if (remove) el.remove();
        }
    }

    // ================= 보조 =================

    static int classWeight(Element el) {
        int w = 0;
        String cls = el.className();
        if (!cls.isEmpty()) {
            if (NEGATIVE.matcher(cls).find()) w -= 25;
            if (POSITIVE.matcher(cls).find()) w += 25;
        }
        String id = el.id();
        if (!id.isEmpty()) {
            if (NEGATIVE.matcher(id).find()) w -= 25;
            if (POSITIVE.matcher(id).find()) w += 25;
        }
        return w;
    }

    static double linkDensity(Element el) {
        int total = el.text().length();
        if (total == 0) return 0;
        int links = 0;
        for (Element a : el.getElementsByTag("a")) links += a.text().length();
        return (double) links / total;
    }

    private static int countCommas(String text) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) if (text.charAt(i) == ',') n++;
        return n;
    }

    private static int textLength(Element el) {
        return (el == null) ? 0 : el.text().trim().length();
    }

    /** 중첩 깊이와 무관하게 동작하도록 순회(NodeTraversor)로 모은 뒤 지운다. */
    private static void removeComments(Node root) {
        List<Node> comments = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof Comment) comments.add(node);
        }, root);
        for (Node c : comments) c.remove();
    }

    /** 블록마다 줄바꿈, 들여쓰기 없음 */
    private static String render(Element article, String baseUri) {
        Document shell = Document.createShell(baseUri == null ? "" : baseUri);
        shell.outputSettings().prettyPrint(true).indentAmount(0);
        if (article.text().isBlank()) return "";
        shell.body().appendChild(article);
        return shell.body().html();
    }
}
