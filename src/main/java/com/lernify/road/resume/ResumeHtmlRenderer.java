package com.lernify.road.resume;

import com.lernify.road.repository.UserJdbcRepository.UserRow;
import com.lernify.road.resume.ResumeModels.Resume;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders a resume as a standalone printable HTML page. Every user supplied value is escaped.
 */
@Component
public class ResumeHtmlRenderer {

    public String render(UserRow user, Resume resume) {
        StringBuilder html = new StringBuilder();
        html.append("<html>\n<head><meta charset='utf-8'><title>Resume</title></head>\n")
                .append("<body style='font-family: Arial, sans-serif; padding: 24px;'>\n")
                .append("  <h1 style='margin:0'>").append(esc(user.firstName())).append(' ').append(esc(user.lastName())).append("</h1>\n")
                .append("  <p style='color:#555;margin:4px 0'>").append(esc(user.email())).append(" &bull; ").append(esc(user.phone())).append("</p>\n")
                .append("  <h2>Summary</h2>\n  <p>").append(esc(resume.summary())).append("</p>\n")
                .append("  <h2>Skills</h2>\n  <p>").append(esc(String.join(", ", resume.skills()))).append("</p>\n")
                .append("  <h2>Education</h2>\n")
                .append(list(resume.education(), e -> "<strong>" + field(e, "degree") + "</strong> - "
                        + field(e, "institution") + " (" + field(e, "year") + ")"))
                .append("  <h2>Experience</h2>\n")
                .append(list(resume.experience(), e -> "<strong>" + field(e, "role") + "</strong> - "
                        + field(e, "company") + " (" + field(e, "duration") + ")<br/>" + field(e, "details")))
                .append("  <h2>Projects</h2>\n")
                .append(list(resume.projects(), p -> "<strong>" + field(p, "name") + "</strong>: " + field(p, "description")))
                .append("</body>\n</html>\n");
        return html.toString();
    }

    private String list(List<Map<String, Object>> entries, Function<Map<String, Object>, String> item) {
        StringBuilder ul = new StringBuilder("  <ul>");
        entries.forEach(e -> ul.append("<li>").append(item.apply(e)).append("</li>"));
        return ul.append("</ul>\n").toString();
    }

    private String field(Map<String, Object> entry, String key) {
        Object value = entry == null ? null : entry.get(key);
        return value == null ? "" : esc(value.toString());
    }

    private String esc(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
