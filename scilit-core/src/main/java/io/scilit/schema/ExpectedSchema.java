package io.scilit.schema;

import java.util.List;
import java.util.Objects;

/**
 * The catalog objects a database must contain to be considered structurally valid.
 *
 * @param tables       tables that must exist
 * @param indexes      explicitly created indexes that must exist
 * @param ftsTable     name of the FTS5 virtual table over paper text
 * @param ftsTriggers  triggers keeping {@code ftsTable} in sync with its content table
 */
public record ExpectedSchema(List<String> tables, List<String> indexes, String ftsTable, List<String> ftsTriggers) {

  /** The schema created by the bundled {@code schema.sql}. */
  public static final ExpectedSchema SCIENTIFIC_LITERATURE = new ExpectedSchema(
      List.of(
          "authors",
          "papers",
          "datasets",
          "paper_authors",
          "citations",
          "paper_datasets",
          "research_trends",
          "collaboration_networks"),
      List.of(
          "idx_papers_doi",
          "idx_papers_publication_date",
          "idx_papers_journal",
          "idx_authors_name",
          "idx_authors_affiliation",
          "idx_paper_authors_paper",
          "idx_paper_authors_author",
          "idx_citations_citing",
          "idx_citations_cited",
          "idx_papers_citation_count",
          "idx_research_trends_year_keyword",
          "idx_papers_domain_date",
          "idx_citations_type_date"),
      "papers_fts",
      List.of("papers_fts_insert", "papers_fts_delete", "papers_fts_update"));

  public ExpectedSchema {
    tables = List.copyOf(Objects.requireNonNull(tables, "tables"));
    indexes = List.copyOf(Objects.requireNonNull(indexes, "indexes"));
    Objects.requireNonNull(ftsTable, "ftsTable");
    ftsTriggers = List.copyOf(Objects.requireNonNull(ftsTriggers, "ftsTriggers"));
  }
}
