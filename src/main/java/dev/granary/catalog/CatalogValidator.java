package dev.granary.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes free-text category and region values produced by field extraction into the fixed
 * vocabularies the catalog is filtered by.
 *
 * <p>Unknown categories become {@link #DEFAULT_CATEGORY}; unknown regions become {@link
 * #DEFAULT_REGION}. When no region is found, it is inferred from the announcement title or the
 * organization name.
 */
public final class CatalogValidator {

  private static final Logger log = LoggerFactory.getLogger(CatalogValidator.class);

  public static final String DEFAULT_CATEGORY = "기타";
  public static final String DEFAULT_REGION = "전국";

  static final Set<String> CATEGORIES =
      Set.of("인력", "수출", "창업", "기술", "자금", "판로", "경영", "R&D", "글로벌", "사업화", "기타");

  static final Set<String> REGIONS =
      Set.of(
          "전국", "서울", "경기", "인천", "강원", "충북", "충남", "대전", "세종", "전북", "전남", "광주", "경북",
          "경남", "대구", "울산", "부산", "제주", "전북특별자치도");

  private static final Pattern DATE_LIKE = Pattern.compile("^\\d{4}[-./]\\d{2}[-./]\\d{2}.*");

  private static final Map<String, String> CATEGORY_ALIASES = new LinkedHashMap<>();
  private static final List<Map.Entry<String, String>> CATEGORY_KEYWORDS =
      List.of(
          Map.entry("투자", "자금"),
          Map.entry("융자", "자금"),
          Map.entry("보증", "자금"),
          Map.entry("자금", "자금"),
          Map.entry("금융", "자금"),
          Map.entry("수출", "수출"),
          Map.entry("해외", "글로벌"),
          Map.entry("글로벌", "글로벌"),
          Map.entry("R&D", "R&D"),
          Map.entry("연구", "R&D"),
          Map.entry("특허", "R&D"),
          Map.entry("사업화", "사업화"),
          Map.entry("기술", "기술"),
          Map.entry("창업", "창업"),
          Map.entry("스타트업", "창업"),
          Map.entry("인력", "인력"),
          Map.entry("교육", "인력"),
          Map.entry("고용", "인력"),
          Map.entry("일자리", "인력"),
          Map.entry("컨설팅", "경영"),
          Map.entry("멘토링", "경영"),
          Map.entry("경영", "경영"),
          Map.entry("판로", "판로"),
          Map.entry("마케팅", "판로"));

  static {
    CATEGORY_ALIASES.put("내수", "판로");
    CATEGORY_ALIASES.put("홍보", "판로");
    CATEGORY_ALIASES.put("네트워크", "경영");
    CATEGORY_ALIASES.put("행사ㆍ네트워크", "경영");
    CATEGORY_ALIASES.put("멘토링ㆍ컨설팅ㆍ교육", "경영");
    CATEGORY_ALIASES.put("판로ㆍ해외진출", "판로");
    CATEGORY_ALIASES.put("수출입", "수출");
    CATEGORY_ALIASES.put("기술이전", "기술");
    CATEGORY_ALIASES.put("인증", "기술");
    CATEGORY_ALIASES.put("보조금", "자금");
    CATEGORY_ALIASES.put("지원금", "자금");
    CATEGORY_ALIASES.put("상용화", "사업화");
    CATEGORY_ALIASES.put("액셀러레이팅", "창업");
    CATEGORY_ALIASES.put("스케일업", "창업");
    CATEGORY_ALIASES.put("입주", "기타");
    CATEGORY_ALIASES.put("공간지원", "기타");
    CATEGORY_ALIASES.put("시설ㆍ공간ㆍ보육", "기타");
  }

  private static final Map<String, String> REGION_ALIASES =
      Map.ofEntries(
          Map.entry("서울특별시", "서울"),
          Map.entry("부산광역시", "부산"),
          Map.entry("대구광역시", "대구"),
          Map.entry("인천광역시", "인천"),
          Map.entry("광주광역시", "광주"),
          Map.entry("대전광역시", "대전"),
          Map.entry("울산광역시", "울산"),
          Map.entry("세종특별자치시", "세종"),
          Map.entry("경기도", "경기"),
          Map.entry("강원도", "강원"),
          Map.entry("강원특별자치도", "강원"),
          Map.entry("충청북도", "충북"),
          Map.entry("충청남도", "충남"),
          Map.entry("전라북도", "전북"),
          Map.entry("전북도", "전북특별자치도"),
          Map.entry("전라남도", "전남"),
          Map.entry("경상북도", "경북"),
          Map.entry("경상남도", "경남"),
          Map.entry("제주특별자치도", "제주"),
          Map.entry("수도권", "전국"),
          Map.entry("서울/경기", "전국"),
          Map.entry("해외", "전국"),
          Map.entry("온라인", "전국"));

  // Ordered: institution names first, then city and province names.
  private static final List<Map.Entry<Pattern, String>> REGION_PATTERNS =
      List.of(
          Map.entry(Pattern.compile("경기(?:도경제과학진흥원|테크노파크|창조경제혁신센터)"), "경기"),
          Map.entry(Pattern.compile("서울"), "서울"),
          Map.entry(Pattern.compile("부산"), "부산"),
          Map.entry(Pattern.compile("대구"), "대구"),
          Map.entry(Pattern.compile("인천"), "인천"),
          Map.entry(Pattern.compile("광주"), "광주"),
          Map.entry(Pattern.compile("대전"), "대전"),
          Map.entry(Pattern.compile("울산"), "울산"),
          Map.entry(Pattern.compile("세종"), "세종"),
          Map.entry(Pattern.compile("경기(?:도)?(?![가-힣])"), "경기"),
          Map.entry(Pattern.compile("강원"), "강원"),
          Map.entry(Pattern.compile("충청북도|충북"), "충북"),
          Map.entry(Pattern.compile("충청남도|충남"), "충남"),
          Map.entry(Pattern.compile("전라북도|전북"), "전북"),
          Map.entry(Pattern.compile("전라남도|전남"), "전남"),
          Map.entry(Pattern.compile("경상북도|경북"), "경북"),
          Map.entry(Pattern.compile("경상남도|경남"), "경남"),
          Map.entry(Pattern.compile("제주"), "제주"));

  private CatalogValidator() {
    // utility class
  }

  /**
   * Maps a raw category to the category vocabulary.
   *
   * @param value raw extracted value, may be null
   * @return a member of the vocabulary, {@link #DEFAULT_CATEGORY} when unknown
   */
  public static String normalizeCategory(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT_CATEGORY;
    }
    String trimmed = value.trim();
    if (CATEGORIES.contains(trimmed)) {
      return trimmed;
    }
    if (REGIONS.contains(trimmed) || DATE_LIKE.matcher(trimmed).matches()) {
      log.debug("Category field holds a region or date: '{}'", trimmed);
      return DEFAULT_CATEGORY;
    }
    String alias = CATEGORY_ALIASES.get(trimmed);
    if (alias != null) {
      return alias;
    }
    for (Map.Entry<String, String> keyword : CATEGORY_KEYWORDS) {
      if (trimmed.contains(keyword.getKey())) {
        return keyword.getValue();
      }
    }
    log.debug("Unknown category '{}', using {}", trimmed, DEFAULT_CATEGORY);
    return DEFAULT_CATEGORY;
  }

  /**
   * Maps a raw region to the region vocabulary.
   *
   * @param value raw extracted value, may be null
   * @return a member of the vocabulary, {@link #DEFAULT_REGION} when unknown
   */
  public static String normalizeRegion(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT_REGION;
    }
    String trimmed = value.trim();
    if (REGIONS.contains(trimmed)) {
      return trimmed;
    }
    String alias = REGION_ALIASES.get(trimmed);
    if (alias != null) {
      return alias;
    }
    if (CATEGORIES.contains(trimmed) || DATE_LIKE.matcher(trimmed).matches()) {
      log.debug("Region field holds a category or date: '{}'", trimmed);
      return DEFAULT_REGION;
    }
    String extracted = extractRegion(trimmed);
    if (extracted != null) {
      return extracted;
    }
    log.debug("Unknown region '{}', using {}", trimmed, DEFAULT_REGION);
    return DEFAULT_REGION;
  }

  /**
   * Finds a region name inside free text such as a title or an organization name.
   *
   * @return the region, or null when none is mentioned
   */
  public static @Nullable String extractRegion(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    for (Map.Entry<Pattern, String> pattern : REGION_PATTERNS) {
      if (pattern.getKey().matcher(text).find()) {
        return pattern.getValue();
      }
    }
    return null;
  }

  /**
   * Normalizes the classification of extracted fields. A missing or nationwide region is
   * refined from the title, then from the organization.
   *
   * @param fields extracted fields
   * @param title announcement title
   * @param organization issuing organization, if known
   * @return fields with vocabulary-conformant category and region
   */
  public static AnnouncementFields normalize(
      AnnouncementFields fields, String title, @Nullable String organization) {
    String region = normalizeRegion(fields.region());
    if (DEFAULT_REGION.equals(region)) {
      String inferred = extractRegion(title);
      if (inferred == null) {
        inferred = extractRegion(organization != null ? organization : fields.organization());
      }
      if (inferred != null) {
        region = inferred;
      }
    }
    return fields.withClassification(normalizeCategory(fields.category()), region);
  }
}
