package info.isaksson.erland.yangprinter.model;

public enum YangVersion {
    V1_0("1.0"),
    V1_1("1.1");

    public final String keyword;

    YangVersion(String keyword) {
        this.keyword = keyword;
    }

    public static YangVersion fromKeyword(String keyword) {
        if (keyword == null) return null;
        String s = keyword.trim();
        if (s.equals("1") || s.equals("1.0")) return V1_0;
        if (s.equals("1.1")) return V1_1;
        throw new IllegalArgumentException("Unknown yang-version: " + keyword);
    }
}
