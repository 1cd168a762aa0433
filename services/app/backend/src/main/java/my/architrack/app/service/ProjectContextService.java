package my.architrack.app.service;

import my.architrack.app.domain.Project;
import my.architrack.app.repository.ProjectRepository;
import my.architrack.app.statement.ProjectNotFoundException;
import org.springframework.stereotype.Service;

@Service
public class ProjectContextService {
	private final ProjectRepository projectRepository;

	public ProjectContextService(ProjectRepository projectRepository) {
		this.projectRepository = projectRepository;
	}

	public Project requireProject(Long projectId) {
		return projectRepository.findById(projectId)
				.filter(project -> !project.isDeleted())
				.orElseThrow(() -> new ProjectNotFoundException(projectId));
	}
}
