package de.mirkosertic.nlpquery.template;

import de.mirkosertic.nlpquery.Language;

import java.util.List;

/**
 * Built-in English and Arabic templates. These cannot be removed from a library.
 */
final class DefaultTemplates {

    private static final List<String> DOCUMENT_TYPES_EN =
            List.of("PDF", "Word", "Excel", "PowerPoint", "image", "video", "text");

    private DefaultTemplates() {
        // Utility class, no instances
    }

    static List<QuestionTemplate> all() {
        return List.of(
                // English
                new QuestionTemplate("find-documents-by-type", TemplateCategory.DISCOVERY,
                        "Find Documents by Type", "Search for documents of a specific type",
                        "Find {type} documents",
                        List.of(TemplateParameter.select("type", DOCUMENT_TYPES_EN)),
                        Language.EN,
                        List.of("Find PDF documents", "Find image documents", "Find Excel documents"),
                        List.of("search", "filter", "type"), 1),
                new QuestionTemplate("find-documents-by-author-and-topic", TemplateCategory.DISCOVERY,
                        "Find Documents by Author and Topic", "Search for documents by author and topic",
                        "Find documents by {author} about {topic}",
                        List.of(TemplateParameter.text("author"), TemplateParameter.text("topic")),
                        Language.EN,
                        List.of("Find documents by John Smith about machine learning",
                                "Find documents by Sarah Johnson about project management"),
                        List.of("search", "author", "topic"), 2),
                new QuestionTemplate("find-recent-documents", TemplateCategory.DISCOVERY,
                        "Find Recent Documents", "Search for recently created or modified documents",
                        "Show me recent documents",
                        List.of(),
                        Language.EN,
                        List.of("Show me recent documents", "Find recent documents"),
                        List.of("recent", "timeline"), 1),
                new QuestionTemplate("count-documents-by-type", TemplateCategory.ANALYTICS,
                        "Count Documents by Type", "Get analytics on document counts by type",
                        "How many {type} documents do we have",
                        List.of(TemplateParameter.select("type",
                                List.of("PDF", "Word", "Excel", "PowerPoint", "image", "video", "text", "all"))),
                        Language.EN,
                        List.of("How many PDF documents do we have", "How many all documents do we have"),
                        List.of("analytics", "count", "type"), 1),
                new QuestionTemplate("show-document-status", TemplateCategory.STATUS,
                        "Show Document Status", "Check the status of documents",
                        "Show documents with {status} status",
                        List.of(TemplateParameter.select("status", List.of("draft", "review", "approved", "archived"))),
                        Language.EN,
                        List.of("Show documents with draft status", "Show documents with approved status"),
                        List.of("status", "workflow"), 1),
                new QuestionTemplate("download-document", TemplateCategory.ACTION,
                        "Download Document", "Download a specific document",
                        "Download document {document_name}",
                        List.of(TemplateParameter.text("document_name")),
                        Language.EN,
                        List.of("Download document annual_report.pdf", "Download document project_plan.docx"),
                        List.of("action", "download"), 2),

                // Arabic
                new QuestionTemplate("find-documents-by-type-ar", TemplateCategory.DISCOVERY,
                        "البحث عن الملفات حسب النوع", "البحث عن ملفات من نوع محدد",
                        "ابحث عن ملفات {type}",
                        List.of(TemplateParameter.select("type",
                                List.of("PDF", "Word", "Excel", "PowerPoint", "صور", "فيديو", "نص"))),
                        Language.AR,
                        List.of("ابحث عن ملفات PDF", "ابحث عن ملفات صور", "ابحث عن ملفات Excel"),
                        List.of("بحث", "تصفية", "نوع"), 1),
                new QuestionTemplate("find-documents-by-author-ar", TemplateCategory.DISCOVERY,
                        "البحث عن الملفات حسب المؤلف", "البحث عن ملفات أنشأها شخص معين",
                        "ابحث عن ملفات بواسطة {author}",
                        List.of(TemplateParameter.text("author")),
                        Language.AR,
                        List.of("ابحث عن ملفات بواسطة أحمد محمد", "ابحث عن ملفات بواسطة فاطمة علي"),
                        List.of("بحث", "مؤلف"), 1),
                new QuestionTemplate("find-recent-documents-ar", TemplateCategory.DISCOVERY,
                        "البحث عن الملفات الحديثة", "البحث عن الملفات التي تم إنشاؤها أو تعديلها مؤخراً",
                        "أظهر لي الملفات الحديثة",
                        List.of(),
                        Language.AR,
                        List.of("أظهر لي الملفات الحديثة", "ابحث عن الملفات الحديثة"),
                        List.of("حديث", "زمني"), 1),
                new QuestionTemplate("count-documents-ar", TemplateCategory.ANALYTICS,
                        "عدد الملفات", "الحصول على إحصائيات عدد الملفات",
                        "كم عدد الملفات لدينا",
                        List.of(),
                        Language.AR,
                        List.of("كم عدد الملفات لدينا", "إحصائيات الملفات"),
                        List.of("إحصائيات", "عدد"), 1),
                new QuestionTemplate("show-document-status-ar", TemplateCategory.STATUS,
                        "عرض حالة الملف", "فحص حالة الملفات",
                        "أظهر الملفات بحالة {status}",
                        List.of(TemplateParameter.select("status", List.of("مسودة", "مراجعة", "معتمد", "مؤرشف"))),
                        Language.AR,
                        List.of("أظهر الملفات بحالة مسودة", "أظهر الملفات بحالة معتمد"),
                        List.of("حالة", "سير العمل"), 1),
                new QuestionTemplate("download-document-ar", TemplateCategory.ACTION,
                        "تحميل الملف", "تحميل ملف معين",
                        "حمّل الملف {document_name}",
                        List.of(TemplateParameter.text("document_name")),
                        Language.AR,
                        List.of("حمّل الملف التقرير_السنوي.pdf", "حمّل الملف خطة_المشروع.docx"),
                        List.of("إجراء", "تحميل"), 2));
    }
}
