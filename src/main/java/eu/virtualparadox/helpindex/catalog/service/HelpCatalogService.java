package eu.virtualparadox.helpindex.catalog.service;

import eu.virtualparadox.helpindex.application.config.ApplicationConfig;
import eu.virtualparadox.helpindex.catalog.model.IndexStatistics;
import eu.virtualparadox.helpindex.catalog.model.NodeSummary;
import eu.virtualparadox.helpindex.catalog.model.PageContent;
import eu.virtualparadox.helpindex.catalog.model.SectionListing;
import eu.virtualparadox.helpindex.index.HelpIndexManager;
import eu.virtualparadox.helpindex.index.change.RebuildDecision;
import eu.virtualparadox.helpindex.index.metadata.IndexMetadata;
import eu.virtualparadox.helpindex.ingest.extractor.ContentExtractor;
import eu.virtualparadox.helpindex.query.HelpSearchService;
import eu.virtualparadox.helpindex.query.model.SearchPage;
import eu.virtualparadox.helpindex.query.model.SearchRequest;
import eu.virtualparadox.helpindex.tree.HelpTree;
import eu.virtualparadox.helpindex.tree.ancestry.AncestryResolver;
import eu.virtualparadox.helpindex.tree.model.BreadcrumbEntry;
import eu.virtualparadox.helpindex.tree.model.HelpNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Operations offered to the serving layer: tree navigation, page retrieval,
 * search and index maintenance.
 * <p>All reads go against the immutable tree or the active index and may run concurrently.</p>
 */
@Service
@RequiredArgsConstructor
public class HelpCatalogService {

    private final HelpTree tree;
    private final AncestryResolver ancestryResolver;
    private final ContentExtractor contentExtractor;
    private final HelpIndexManager indexManager;
    private final HelpSearchService searchService;
    private final ApplicationConfig props;

    public HelpTree getTree() {
        return tree;
    }

    public List<BreadcrumbEntry> breadcrumb(final String nodeId) {
        return ancestryResolver.breadcrumb(nodeId);
    }

    public Optional<HelpNode> lookupByStableId(final String helpId) {
        return tree.findByHelpId(helpId);
    }

    /**
     * @return the change check result; a missing or unreadable structure document reports
     *         {@code SOURCE_CHANGED}
     */
    public RebuildDecision needsRebuild() {
        return indexManager.needsRebuild();
    }

    /**
     * Re-indexes the tree loaded at startup. Changes to the structure document made while running
     * take effect after a restart.
     */
    public IndexMetadata rebuild() {
        return indexManager.rebuild();
    }

    public SearchPage search(final String query, final int offset, final int limit) {
        return searchService.search(query, offset, limit);
    }

    public SearchPage search(final SearchRequest request) {
        return searchService.search(request);
    }

    /**
     * @param pageId node identity
     * @return the node with its extracted text and breadcrumb, empty when unknown
     */
    public Optional<PageContent> getPage(final String pageId) {
        return tree.getNode(pageId).map(this::toPageContent);
    }

    public Optional<PageContent> getPageByStableId(final String helpId) {
        return tree.findByHelpId(helpId).map(this::toPageContent);
    }

    /**
     * @return the top-level nodes, which define the search categories
     */
    public List<NodeSummary> getCategories() {
        return tree.roots().stream().map(this::toSummary).toList();
    }

    /**
     * @param sectionId node identity
     * @return the node and its direct children, empty when unknown
     */
    public Optional<SectionListing> browseSection(final String sectionId) {
        return tree.getNode(sectionId).map(node -> new SectionListing(
                toSummary(node),
                tree.children(node).stream().map(this::toSummary).toList()));
    }

    public IndexStatistics getStatistics() {
        final Optional<IndexMetadata> metadata = indexManager.currentMetadata();
        return new IndexStatistics(
                metadata.map(IndexMetadata::documentCount).orElse(0),
                metadata.map(IndexMetadata::builtAt).orElse(null),
                tree.size(),
                tree.pageCount(),
                tree.sectionCount(),
                tree.helpIdCount(),
                tree.getSourceSizeBytes(),
                indexManager.getIndexPath().toString(),
                indexManager.isRebuilding());
    }

    private PageContent toPageContent(final HelpNode node) {
        return new PageContent(
                node.getId(),
                node.getTitle(),
                node.getKind().name(),
                node.getHelpIds(),
                ancestryResolver.breadcrumb(node.getId()).stream().map(BreadcrumbEntry::title).toList(),
                contentExtractor.extractText(node),
                node.getFile(),
                onlineHelpUrl(node));
    }

    private NodeSummary toSummary(final HelpNode node) {
        return new NodeSummary(
                node.getId(),
                node.getTitle(),
                node.getKind().name(),
                node.getChildIds().size(),
                node.primaryHelpId().orElse(null));
    }

    private String onlineHelpUrl(final HelpNode node) {
        final String base = props.getOnlineHelpBaseUrl();
        if (base == null || base.isBlank() || !node.hasFile()) {
            return null;
        }
        final String file = node.getFile().replace('\\', '/');
        return base.endsWith("/") ? base + file : base + "/" + file;
    }
}
