package com.my.bridge.domain.service;

import com.my.bridge.domain.model.FilterOptions;
import com.my.bridge.domain.model.FilterRules;
import com.my.bridge.domain.model.FilterVerdict;
import com.my.bridge.domain.model.ReasonCode;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 메시지 텍스트를 악용 시그니처(욕설, 악성 링크, 스팸, 대량 멘션, 토큰 유출)로 분류하는 규칙을 한 곳에 모으기 위함.
 * 상태가 없어 동기화 없이 여러 스레드에서 호출해도 된다.
 */
public class ContentFilter {

    private static final Logger log = Logger.getLogger(ContentFilter.class);

    // 스킴이 있는 URL은 호스트 형태와 상관없이, 스킴이 없으면 영문 TLD를 가진 도메인만 잡는다.
    private static final Pattern URL_PATTERN = Pattern.compile(
            "https?://[^\\s<>\"'`]+"
                    + "|(?<![\\w@.-])(?:www\\.)?(?:[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}(?::\\d{1,5})?(?:/[^\\s<>\"'`]*)?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern MENTION_PATTERN = Pattern.compile("@(everyone|here)", Pattern.CASE_INSENSITIVE);

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
            "[MN][A-Za-z\\d]{23}\\.[\\w-]{6}\\.[\\w-]{27}|mfa\\.[\\w-]{84}");

    private static final Pattern FAKE_GIFT_PATTERN = Pattern.compile(
            "discord(?:\\.(?:gift|nitro|app)|app\\.com/gifts?)|(?:free|steam|discord)-?nitro",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SCHEME_PREFIX = Pattern.compile("^https?://");

    private static final Pattern IPV4_HOST = Pattern.compile("^(?:\\d{1,3}\\.){3}\\d{1,3}$");

    private static final List<String> TRACKING_PATH_MARKERS = List.of("/logger", "/grab", "/track", "/ip");

    private static final int UNICODE_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<Pattern> SPAM_PATTERNS = List.of(
            Pattern.compile("(.)\\1{9,}", Pattern.DOTALL),
            Pattern.compile("(.{1,5})\\1{4,}", Pattern.DOTALL),
            Pattern.compile("\\b(?:free|бесплатн).*(?:nitro|discord)", UNICODE_FLAGS | Pattern.DOTALL),
            Pattern.compile("\\b(?:win|выигра).*(?:money|деньг|приз)", UNICODE_FLAGS | Pattern.DOTALL),
            Pattern.compile("\\b(?:click|кликн|переход).*(?:link|ссылк)", UNICODE_FLAGS | Pattern.DOTALL));

    private final FilterRules rules;

    public ContentFilter(FilterRules rules) {
        this.rules = rules;
    }

    public FilterVerdict classify(String text, FilterOptions options) {
        if (text == null || text.isBlank()) {
            return FilterVerdict.of(Set.of());
        }
        EnumSet<ReasonCode> reasons = EnumSet.noneOf(ReasonCode.class);
        if (options.profanity() && containsProfanity(text)) {
            reasons.add(ReasonCode.PROFANITY);
        }
        if (options.links() && containsBlockedLink(text)) {
            reasons.add(ReasonCode.BLOCKED_LINK);
        }
        if (options.spam() && matchesSpamPattern(text)) {
            reasons.add(ReasonCode.SPAM_PATTERN);
        }
        if (options.massMentions() && containsMassMentions(text)) {
            reasons.add(ReasonCode.MASS_MENTION);
        }
        if (options.tokens() && containsToken(text)) {
            reasons.add(ReasonCode.TOKEN_LEAK);
        }
        return FilterVerdict.of(reasons);
    }

    public FilterVerdict classify(String text) {
        return classify(text, FilterOptions.all());
    }

    public boolean containsProfanity(String text) {
        if (text == null || rules.profanityWords().isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String word : rules.profanityWords()) {
            if (lower.contains(word)) {
                log.debugf("욕설 목록 단어 감지: %s", word);
                return true;
            }
        }
        return false;
    }

    public boolean containsBlockedLink(String text) {
        if (text == null) {
            return false;
        }
        for (String url : extractUrls(text)) {
            if (isSuspiciousUrl(url)) {
                log.infof("의심스러운 링크 감지: %s", url);
                return true;
            }
        }
        return false;
    }

    public boolean matchesSpamPattern(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Pattern pattern : SPAM_PATTERNS) {
            if (pattern.matcher(lower).find()) {
                log.debugf("스팸 패턴 감지: %s", pattern.pattern());
                return true;
            }
        }
        return false;
    }

    public boolean containsMassMentions(String text) {
        if (text == null) {
            return false;
        }
        Matcher matcher = MENTION_PATTERN.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
            if (count >= rules.massMentionThreshold()) {
                return true;
            }
        }
        return false;
    }

    public boolean containsToken(String text) {
        return text != null && TOKEN_PATTERN.matcher(text).find();
    }

    public List<String> extractUrls(String text) {
        List<String> urls = new ArrayList<>();
        Matcher matcher = URL_PATTERN.matcher(text);
        while (matcher.find()) {
            urls.add(matcher.group());
        }
        return urls;
    }

    boolean isSuspiciousUrl(String url) {
        String lowered = url.toLowerCase(Locale.ROOT);
        String rest = SCHEME_PREFIX.matcher(lowered).replaceFirst("");
        int authorityEnd = indexOfAny(rest, "/?#");
        String host = hostOf(authorityEnd < 0 ? rest : rest.substring(0, authorityEnd));
        if (host.isEmpty()) {
            log.warnf("URL에서 호스트를 찾지 못해 안전한 링크로 취급합니다: %s", url);
            return false;
        }
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        if (isBlockedDomain(host)) {
            return true;
        }
        if (FAKE_GIFT_PATTERN.matcher(lowered).find()) {
            return true;
        }
        if (IPV4_HOST.matcher(host).matches()) {
            return true;
        }
        if (host.length() < 6 && host.chars().anyMatch(Character::isDigit)) {
            return true;
        }
        String path = authorityEnd < 0 ? "" : rest.substring(authorityEnd);
        int queryStart = indexOfAny(path, "?#");
        String rawPath = queryStart < 0 ? path : path.substring(0, queryStart);
        return TRACKING_PATH_MARKERS.stream().anyMatch(rawPath::contains);
    }

    // 사용자 정보와 포트를 떼어낸 호스트. 경로는 검사하지 않는다.
    private static String hostOf(String authority) {
        String host = authority.substring(authority.lastIndexOf('@') + 1);
        if (host.startsWith("[")) {
            int close = host.indexOf(']');
            return close < 0 ? host.substring(1) : host.substring(1, close);
        }
        int colon = host.indexOf(':');
        if (colon >= 0) {
            host = host.substring(0, colon);
        }
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host;
    }

    private static int indexOfAny(String value, String chars) {
        for (int i = 0; i < value.length(); i++) {
            if (chars.indexOf(value.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    private boolean isBlockedDomain(String host) {
        if (rules.blockedDomains().contains(host)) {
            return true;
        }
        for (String blocked : rules.blockedDomains()) {
            if (host.endsWith("." + blocked)) {
                return true;
            }
        }
        return false;
    }
}
