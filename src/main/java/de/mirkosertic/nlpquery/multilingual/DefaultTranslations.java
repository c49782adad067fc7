package de.mirkosertic.nlpquery.multilingual;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in Arabic to English dictionary and the transliteration table for loan words.
 */
final class DefaultTranslations {

    private DefaultTranslations() {
        // Utility class, no instances
    }

    static Map<String, List<String>> arabicToEnglish() {
        final Map<String, List<String>> dictionary = new LinkedHashMap<>();

        // Documents and media
        dictionary.put("مستند", List.of("document", "file", "record"));
        dictionary.put("وثيقة", List.of("document", "paper", "record"));
        dictionary.put("ملف", List.of("file", "document", "folder"));
        dictionary.put("تقرير", List.of("report", "document", "analysis"));
        dictionary.put("سجل", List.of("record", "log", "registry"));
        dictionary.put("صورة", List.of("image", "picture", "photo"));
        dictionary.put("فيديو", List.of("video", "clip", "recording"));
        dictionary.put("صوت", List.of("audio", "sound", "voice"));

        // Technology
        dictionary.put("نظام", List.of("system", "platform", "application"));
        dictionary.put("برنامج", List.of("program", "software", "application"));
        dictionary.put("تطبيق", List.of("application", "app", "software"));
        dictionary.put("خادم", List.of("server", "host", "machine"));
        dictionary.put("شبكة", List.of("network", "connection", "infrastructure"));
        dictionary.put("قاعدة بيانات", List.of("database", "datastore", "repository"));
        dictionary.put("أمان", List.of("security", "safety", "protection"));
        dictionary.put("حماية", List.of("protection", "security", "defense"));
        dictionary.put("إعداد", List.of("configuration", "setup", "settings"));
        dictionary.put("تهيئة", List.of("configuration", "setup", "initialization"));

        // Actions
        dictionary.put("ابحث", List.of("search", "find", "look"));
        dictionary.put("اعثر", List.of("find", "locate", "discover"));
        dictionary.put("أظهر", List.of("show", "display", "present"));
        dictionary.put("اعرض", List.of("display", "show", "present"));
        dictionary.put("افتح", List.of("open", "access", "launch"));
        dictionary.put("حمّل", List.of("download", "load", "fetch"));
        dictionary.put("شارك", List.of("share", "distribute", "send"));
        dictionary.put("احذف", List.of("delete", "remove", "erase"));
        dictionary.put("عدّل", List.of("edit", "modify", "update"));
        dictionary.put("انسخ", List.of("copy", "duplicate", "replicate"));

        // Business
        dictionary.put("سياسة", List.of("policy", "procedure", "guideline"));
        dictionary.put("إجراء", List.of("procedure", "process", "method"));
        dictionary.put("موظف", List.of("employee", "staff", "worker"));
        dictionary.put("فريق", List.of("team", "group", "crew"));
        dictionary.put("مشروع", List.of("project", "initiative", "program"));
        dictionary.put("اجتماع", List.of("meeting", "conference", "session"));
        dictionary.put("تدريب", List.of("training", "education", "course"));
        dictionary.put("ميزانية", List.of("budget", "funds", "allocation"));
        dictionary.put("عقد", List.of("contract", "agreement", "deal"));

        // Time
        dictionary.put("اليوم", List.of("today", "current", "now"));
        dictionary.put("أمس", List.of("yesterday", "previous", "past"));
        dictionary.put("غداً", List.of("tomorrow", "next", "future"));
        dictionary.put("أسبوع", List.of("week", "weekly", "period"));
        dictionary.put("شهر", List.of("month", "monthly", "period"));
        dictionary.put("سنة", List.of("year", "annual", "yearly"));
        dictionary.put("حديث", List.of("recent", "new", "latest"));
        dictionary.put("قديم", List.of("old", "previous", "archived"));

        // Descriptive
        dictionary.put("مهم", List.of("important", "critical", "essential"));
        dictionary.put("عاجل", List.of("urgent", "priority", "immediate"));
        dictionary.put("سري", List.of("confidential", "private", "classified"));
        dictionary.put("عام", List.of("public", "general", "common"));
        dictionary.put("خاص", List.of("private", "personal", "specific"));
        dictionary.put("رسمي", List.of("official", "formal", "authorized"));
        dictionary.put("مؤقت", List.of("temporary", "interim", "provisional"));
        dictionary.put("دائم", List.of("permanent", "fixed", "constant"));

        return dictionary;
    }

    /**
     * English loan words and brand names with their usual Arabic spelling.
     */
    static Map<String, String> transliterations() {
        final Map<String, String> patterns = new LinkedHashMap<>();
        patterns.put("email", "إيميل");
        patterns.put("internet", "إنترنت");
        patterns.put("computer", "كومبيوتر");
        patterns.put("software", "سوفتوير");
        patterns.put("hardware", "هاردوير");
        patterns.put("website", "موقع");
        patterns.put("online", "أونلاين");
        patterns.put("offline", "أوفلاين");
        patterns.put("digital", "رقمي");
        patterns.put("mobile", "موبايل");
        patterns.put("tablet", "تابلت");
        patterns.put("laptop", "لابتوب");
        patterns.put("desktop", "ديسكتوب");
        patterns.put("server", "سيرفر");
        patterns.put("router", "راوتر");
        patterns.put("modem", "مودم");
        patterns.put("wifi", "واي فاي");
        patterns.put("bluetooth", "بلوتوث");
        return patterns;
    }
}
