package de.mirkosertic.nlpquery.expansion;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in synonym and acronym tables.
 */
final class DefaultDictionaries {

    private DefaultDictionaries() {
    }

    static Map<String, List<String>> synonyms() {
        final Map<String, List<String>> synonyms = new LinkedHashMap<>();
        // technical
        synonyms.put("server", List.of("infrastructure", "system", "machine", "host"));
        synonyms.put("database", List.of("db", "datastore", "repository", "storage"));
        synonyms.put("application", List.of("app", "software", "program", "system"));
        synonyms.put("document", List.of("file", "record", "paper", "report"));
        synonyms.put("user", List.of("person", "individual", "account", "member"));
        synonyms.put("security", List.of("protection", "safety", "defense", "access control"));
        synonyms.put("network", List.of("connection", "infrastructure", "communication", "link"));
        synonyms.put("configuration", List.of("setup", "settings", "parameters", "options"));
        synonyms.put("backup", List.of("copy", "archive", "restore", "recovery"));
        synonyms.put("performance", List.of("speed", "efficiency", "optimization", "throughput"));
        // business
        synonyms.put("policy", List.of("procedure", "guideline", "rule", "standard"));
        synonyms.put("employee", List.of("staff", "worker", "personnel", "team member"));
        synonyms.put("project", List.of("initiative", "program", "effort", "task"));
        synonyms.put("meeting", List.of("conference", "discussion", "session", "gathering"));
        synonyms.put("training", List.of("education", "learning", "development", "course"));
        synonyms.put("budget", List.of("funds", "allocation", "expenses", "financial plan"));
        synonyms.put("contract", List.of("agreement", "deal", "terms", "arrangement"));
        synonyms.put("report", List.of("document", "analysis", "summary", "findings"));
        synonyms.put("process", List.of("procedure", "workflow", "method", "approach"));
        synonyms.put("issue", List.of("problem", "concern", "matter", "difficulty"));
        // Arabic
        synonyms.put("مستند", List.of("وثيقة", "ملف", "تقرير", "سجل"));
        synonyms.put("نظام", List.of("برنامج", "تطبيق", "منصة", "خدمة"));
        synonyms.put("مستخدم", List.of("شخص", "عضو", "حساب", "فرد"));
        synonyms.put("أمان", List.of("حماية", "أمن", "سلامة", "حراسة"));
        synonyms.put("شبكة", List.of("اتصال", "ربط", "تواصل", "شبكة اتصال"));
        synonyms.put("إعداد", List.of("تكوين", "ضبط", "تهيئة", "تحديد"));
        synonyms.put("نسخة احتياطية", List.of("أرشيف", "حفظ", "استرداد", "نسخ"));
        synonyms.put("أداء", List.of("سرعة", "كفاءة", "تحسين", "معدل"));
        synonyms.put("سياسة", List.of("إجراء", "قاعدة", "معيار", "نهج"));
        synonyms.put("موظف", List.of("عامل", "طاقم", "فريق", "شخص"));
        return synonyms;
    }

    static Map<String, List<String>> acronyms() {
        final Map<String, List<String>> acronyms = new LinkedHashMap<>();
        acronyms.put("API", List.of("Application Programming Interface", "interface", "service"));
        acronyms.put("UI", List.of("User Interface", "interface", "frontend"));
        acronyms.put("UX", List.of("User Experience", "experience", "usability"));
        acronyms.put("DB", List.of("Database", "datastore", "storage"));
        acronyms.put("SQL", List.of("Structured Query Language", "database query", "query"));
        acronyms.put("HTTP", List.of("HyperText Transfer Protocol", "web protocol", "protocol"));
        acronyms.put("HTTPS", List.of("HTTP Secure", "secure protocol", "encrypted"));
        acronyms.put("URL", List.of("Uniform Resource Locator", "web address", "link"));
        acronyms.put("PDF", List.of("Portable Document Format", "document format", "file"));
        acronyms.put("CSV", List.of("Comma Separated Values", "data format", "spreadsheet"));
        acronyms.put("JSON", List.of("JavaScript Object Notation", "data format", "structured data"));
        acronyms.put("XML", List.of("eXtensible Markup Language", "markup language", "structured data"));
        acronyms.put("HTML", List.of("HyperText Markup Language", "web markup", "webpage"));
        acronyms.put("CSS", List.of("Cascading Style Sheets", "styling", "design"));
        acronyms.put("JS", List.of("JavaScript", "scripting", "programming"));
        acronyms.put("AI", List.of("Artificial Intelligence", "machine learning", "automation"));
        acronyms.put("ML", List.of("Machine Learning", "artificial intelligence", "data science"));
        acronyms.put("IT", List.of("Information Technology", "technology", "computing"));
        acronyms.put("HR", List.of("Human Resources", "personnel", "staff management"));
        acronyms.put("FAQ", List.of("Frequently Asked Questions", "questions", "help"));
        acronyms.put("SOP", List.of("Standard Operating Procedure", "procedure", "process"));
        acronyms.put("KPI", List.of("Key Performance Indicator", "metric", "measurement"));
        acronyms.put("ROI", List.of("Return on Investment", "profitability", "financial return"));
        acronyms.put("CRM", List.of("Customer Relationship Management", "customer management", "sales"));
        acronyms.put("ERP", List.of("Enterprise Resource Planning", "business management", "integration"));
        return acronyms;
    }
}
